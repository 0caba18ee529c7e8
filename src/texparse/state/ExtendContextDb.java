package texparse.state;

import texparse.context.EnvironmentSpec;
import texparse.context.MacroSpec;
import texparse.context.SpecialsSpec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Makes additional definitions visible, e.g. after a construct that defines a new macro.
 */
public class ExtendContextDb extends ParsingStateDelta {
	private final List<MacroSpec> macros;
	private final List<EnvironmentSpec> environments;
	private final List<SpecialsSpec> specials;

	public ExtendContextDb(List<MacroSpec> macros, List<EnvironmentSpec> environments,
	                       List<SpecialsSpec> specials) {
		this.macros = Collections.unmodifiableList(new ArrayList<>(macros));
		this.environments = Collections.unmodifiableList(new ArrayList<>(environments));
		this.specials = Collections.unmodifiableList(new ArrayList<>(specials));
	}

	public List<MacroSpec> getMacros() {
		return macros;
	}

	public List<EnvironmentSpec> getEnvironments() {
		return environments;
	}

	public List<SpecialsSpec> getSpecials() {
		return specials;
	}

	@Override
	public ParsingState apply(ParsingState state, ParsingStateEventHandler handler) {
		return state.toBuilder()
				.setContextDb(state.getContextDb().extendedWith(macros, environments, specials))
				.build();
	}
}
