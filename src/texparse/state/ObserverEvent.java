package texparse.state;

/**
 * A notification for whoever embeds the walker. Leaves the parsing state as it is.
 */
public class ObserverEvent extends ParsingStateDelta {
	private final String name;
	private final Object payload;

	public ObserverEvent(String name, Object payload) {
		this.name = name;
		this.payload = payload;
	}

	public String getName() {
		return name;
	}

	public Object getPayload() {
		return payload;
	}

	@Override
	public ParsingState apply(ParsingState state, ParsingStateEventHandler handler) {
		handler.observe(this, state);
		return state;
	}

	@Override
	public String toString() {
		return "ObserverEvent [name=" + name + ", payload=" + payload + "]";
	}
}
