package texparse.state;

@FunctionalInterface
public interface ParsingStateListener {
	void parsingStateEvent(ObserverEvent event, ParsingState state);
}
