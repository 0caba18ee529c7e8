package texparse.state;

import org.junit.Before;
import org.junit.Test;
import texparse.context.LatexContextDb;
import texparse.context.MacroSpec;
import texparse.lexer.DelimiterPair;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.assertThat;

public class ParsingStateDeltaTest {

	private LatexContextDb db;
	private ParsingState state;

	@Before
	public void setUp() {
		db = new LatexContextDb();
		db.addContextCategory("base", Collections.singletonList(new MacroSpec("emph", "{")),
				Collections.emptyList(), Collections.emptyList());
		db.freeze();
		state = ParsingState.builder("x", db).build();
	}

	@Test
	public void enterAndLeaveMathMode() {
		ParsingState math = new EnterMathMode("$", null).apply(state, ParsingStateEventHandler.DEFAULT);
		assertThat(math.isInMathMode(), is(true));
		assertThat(math.getMathModeDelimiter(), is("$"));
		assertThat(math.getExpectedClosingMathDelimiter().getDelimiter(), is("$"));
		assertThat(state.isInMathMode(), is(false));

		ParsingState text = new LeaveMathMode().apply(math, ParsingStateEventHandler.DEFAULT);
		assertThat(text.isInMathMode(), is(false));
		assertThat(text.getMathModeDelimiter(), is(nullValue()));
		assertThat(text, is(state));
	}

	@Test
	public void leavingMathModeOutsideMathIsANoOp() {
		assertThat(new LeaveMathMode().apply(state, ParsingStateEventHandler.DEFAULT), is(sameInstance(state)));
	}

	@Test
	public void mathEnvironmentHasNoClosingDelimiter() {
		ParsingState math = new EnterMathMode(null, null).apply(state, ParsingStateEventHandler.DEFAULT);
		assertThat(math.isInMathMode(), is(true));
		assertThat(math.getExpectedClosingMathDelimiter(), is(nullValue()));
	}

	@Test
	public void displayDelimiterClosesWithMatchingToken() {
		ParsingState math = new EnterMathMode("\\[", null).apply(state, ParsingStateEventHandler.DEFAULT);
		assertThat(math.getExpectedClosingMathDelimiter().getDelimiter(), is("\\]"));
	}

	@Test
	public void chainedDeltasFlatten() {
		ParsingStateDelta a = new LeaveMathMode();
		ParsingStateDelta b = new EnterMathMode("$", null);
		ParsingStateDelta c = new ObserverEvent("c", null);
		ChainedDelta left = ChainedDelta.of(ChainedDelta.of(a, b), c);
		ChainedDelta right = ChainedDelta.of(a, ChainedDelta.of(b, c));
		assertThat(left.getDeltas(), is(Arrays.asList(a, b, c)));
		assertThat(right.getDeltas(), is(left.getDeltas()));
		assertThat(ChainedDelta.of(a, null).getDeltas(), is(Collections.singletonList(a)));
	}

	@Test
	public void chainedDeltasApplyInOrder() {
		ParsingStateDelta delta = new EnterMathMode("$", null).andThen(new LeaveMathMode());
		assertThat(delta.apply(state, ParsingStateEventHandler.DEFAULT).isInMathMode(), is(false));
		ParsingStateDelta reversed = new LeaveMathMode().andThen(new EnterMathMode("$", null));
		assertThat(reversed.apply(state, ParsingStateEventHandler.DEFAULT).isInMathMode(), is(true));
	}

	@Test
	public void observerEventReachesHandlerAndKeepsState() {
		List<String> seen = new ArrayList<>();
		ParsingStateEventHandler handler = new ParsingStateEventHandler() {
			@Override
			public void observe(ObserverEvent event, ParsingState s) {
				seen.add(event.getName() + "=" + event.getPayload());
			}
		};
		ParsingState result = new ObserverEvent("label", "sec:intro").apply(state, handler);
		assertThat(result, is(sameInstance(state)));
		assertThat(seen, is(Collections.singletonList("label=sec:intro")));
	}

	@Test
	public void extendContextDbAddsDefinitions() {
		MacroSpec foo = new MacroSpec("foo", "{{");
		ParsingState extended = new ExtendContextDb(Collections.singletonList(foo), Collections.emptyList(),
				Collections.emptyList()).apply(state, ParsingStateEventHandler.DEFAULT);
		assertThat(extended.getContextDb().findMacroSpec("foo"), is(sameInstance(foo)));
		assertThat(extended.getContextDb().findMacroSpec("emph"), is(notNullValue()));
		assertThat(state.getContextDb().findMacroSpec("foo"), is(nullValue()));
	}

	@Test
	public void replaceAndUpdate() {
		ParsingState other = ParsingState.builder("y", db).build();
		assertThat(new ReplaceParsingState(other).apply(state, ParsingStateEventHandler.DEFAULT),
				is(sameInstance(other)));

		ParsingState noMacros = new UpdateParsingState(b -> b.setEnableMacros(false))
				.apply(state, ParsingStateEventHandler.DEFAULT);
		assertThat(noMacros.isEnableMacros(), is(false));
		assertThat(state.isEnableMacros(), is(true));
		assertThat(noMacros, is(not(state)));
	}

	@Test
	public void groupDelimitersAreExtendedOnce() {
		DelimiterPair brackets = new DelimiterPair("[", "]");
		ParsingState withBrackets = state.toBuilder().addGroupDelimiter(brackets).addGroupDelimiter(brackets).build();
		assertThat(withBrackets.getGroupDelimiters(),
				is(Arrays.asList(new DelimiterPair("{", "}"), brackets)));
		assertThat(withBrackets.isGroupOpen('['), is(true));
		assertThat(state.isGroupOpen('['), is(false));
	}

	@Test
	public void stateEquality() {
		assertThat(ParsingState.builder("x", db).build(), is(state));
		assertThat(ParsingState.builder("x", db).build().hashCode(), is(state.hashCode()));
		LatexContextDb otherDb = new LatexContextDb();
		otherDb.freeze();
		assertThat(ParsingState.builder("x", otherDb).build(), is(not(state)));
	}
}
