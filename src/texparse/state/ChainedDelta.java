package texparse.state;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class ChainedDelta extends ParsingStateDelta {
	private final List<ParsingStateDelta> deltas;

	public ChainedDelta(List<ParsingStateDelta> deltas) {
		this.deltas = Collections.unmodifiableList(new ArrayList<>(deltas));
	}

	/**
	 * Chains two deltas, flattening nested chains so that composition stays associative.
	 */
	public static ChainedDelta of(ParsingStateDelta first, ParsingStateDelta second) {
		List<ParsingStateDelta> deltas = new ArrayList<>();
		addFlattened(deltas, first);
		addFlattened(deltas, second);
		return new ChainedDelta(deltas);
	}

	private static void addFlattened(List<ParsingStateDelta> deltas, ParsingStateDelta delta) {
		if (delta instanceof ChainedDelta) {
			deltas.addAll(((ChainedDelta) delta).deltas);
		} else if (delta != null) {
			deltas.add(delta);
		}
	}

	public List<ParsingStateDelta> getDeltas() {
		return deltas;
	}

	@Override
	public ParsingState apply(ParsingState state, ParsingStateEventHandler handler) {
		ParsingState current = state;
		for (ParsingStateDelta delta : deltas) {
			current = delta.apply(current, handler);
		}
		return current;
	}
}
