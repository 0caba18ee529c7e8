package texparse.context;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A named batch of specs registered together in a {@link LatexContextDb}.
 */
public final class ContextCategory {
	private final String name;
	private final Map<String, MacroSpec> macros;
	private final Map<String, EnvironmentSpec> environments;
	private final Map<String, SpecialsSpec> specials;

	public ContextCategory(String name, Collection<MacroSpec> macros, Collection<EnvironmentSpec> environments,
	                       Collection<SpecialsSpec> specials) {
		this.name = name;
		Map<String, MacroSpec> macroMap = new LinkedHashMap<>();
		for (MacroSpec spec : macros) {
			macroMap.put(spec.getName(), spec);
		}
		Map<String, EnvironmentSpec> environmentMap = new LinkedHashMap<>();
		for (EnvironmentSpec spec : environments) {
			environmentMap.put(spec.getName(), spec);
		}
		Map<String, SpecialsSpec> specialsMap = new LinkedHashMap<>();
		for (SpecialsSpec spec : specials) {
			specialsMap.put(spec.getSpecialsChars(), spec);
		}
		this.macros = Collections.unmodifiableMap(macroMap);
		this.environments = Collections.unmodifiableMap(environmentMap);
		this.specials = Collections.unmodifiableMap(specialsMap);
	}

	public String getName() {
		return name;
	}

	public Map<String, MacroSpec> getMacros() {
		return macros;
	}

	public Map<String, EnvironmentSpec> getEnvironments() {
		return environments;
	}

	public Map<String, SpecialsSpec> getSpecials() {
		return specials;
	}

	ContextCategory filtered(boolean keepMacros, boolean keepEnvironments, boolean keepSpecials) {
		return new ContextCategory(name,
				keepMacros ? macros.values() : Collections.<MacroSpec>emptyList(),
				keepEnvironments ? environments.values() : Collections.<EnvironmentSpec>emptyList(),
				keepSpecials ? specials.values() : Collections.<SpecialsSpec>emptyList());
	}

	@Override
	public String toString() {
		return "ContextCategory [name=" + name + ", macros=" + macros.keySet() + ", environments=" +
				environments.keySet() + ", specials=" + specials.keySet() + "]";
	}
}
