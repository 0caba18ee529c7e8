package texparse.context;

import texparse.errors.UnknownConstructException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * A registry of macro, environment and specials specs, organised in named categories.
 *
 * <p>When several categories define the same name, the category that comes later in the
 * category order wins. Categories are appended by default; they can also be prepended, which
 * gives them the lowest precedence, or inserted relative to an existing category.</p>
 *
 * <p>A database is populated, then frozen. Frozen databases are immutable and safe to share
 * between threads; {@link #filteredContext} and {@link #extendedWith} derive new databases
 * without touching the original. Lookups never modify the database.</p>
 */
public class LatexContextDb {

	private static final Logger logger = Logger.getLogger("TeXParse Context");

	/**
	 * Where {@link #addContextCategory} places a new category.
	 */
	public static final class Placement {
		private enum Kind { APPEND, PREPEND, BEFORE, AFTER }

		private final Kind kind;
		private final String reference;

		private Placement(Kind kind, String reference) {
			this.kind = kind;
			this.reference = reference;
		}

		public static Placement append() {
			return new Placement(Kind.APPEND, null);
		}

		public static Placement prepend() {
			return new Placement(Kind.PREPEND, null);
		}

		public static Placement before(String category) {
			return new Placement(Kind.BEFORE, category);
		}

		public static Placement after(String category) {
			return new Placement(Kind.AFTER, category);
		}
	}

	private final List<ContextCategory> categories = new ArrayList<>();
	private MacroSpec unknownMacroSpec;
	private EnvironmentSpec unknownEnvironmentSpec;
	private SpecialsSpec unknownSpecialsSpec;
	private boolean frozen = false;
	private int extensionCount = 0;

	// merged views, later categories overriding earlier ones
	private Map<String, MacroSpec> macroLookup = new HashMap<>();
	private Map<String, EnvironmentSpec> environmentLookup = new HashMap<>();
	private Map<String, SpecialsSpec> specialsLookup = new HashMap<>();
	private int maxSpecialsLength = 0;

	public void addContextCategory(String name, Collection<MacroSpec> macros,
	                               Collection<EnvironmentSpec> environments, Collection<SpecialsSpec> specials) {
		addContextCategory(name, macros, environments, specials, Placement.append());
	}

	public void addContextCategory(String name, Collection<MacroSpec> macros,
	                               Collection<EnvironmentSpec> environments, Collection<SpecialsSpec> specials,
	                               Placement placement) {
		checkNotFrozen();
		if (findCategoryIndex(name) != -1) {
			throw new IllegalArgumentException("context category ‘" + name + "’ is already registered");
		}
		ContextCategory category = new ContextCategory(name, macros, environments, specials);
		switch (placement.kind) {
			case APPEND:
				categories.add(category);
				break;
			case PREPEND:
				categories.add(0, category);
				break;
			case BEFORE:
				categories.add(requireCategoryIndex(placement.reference), category);
				break;
			case AFTER:
				categories.add(requireCategoryIndex(placement.reference) + 1, category);
				break;
		}
		logger.fine("registered context category ‘" + name + "’ with " + macros.size() + " macro(s), " +
				environments.size() + " environment(s), " + specials.size() + " specials");
		rebuildLookups();
	}

	private int findCategoryIndex(String name) {
		for (int i = 0; i < categories.size(); ++i) {
			if (categories.get(i).getName().equals(name)) {
				return i;
			}
		}
		return -1;
	}

	private int requireCategoryIndex(String name) {
		int index = findCategoryIndex(name);
		if (index == -1) {
			throw new IllegalArgumentException("no context category named ‘" + name + "’");
		}
		return index;
	}

	private void rebuildLookups() {
		Map<String, MacroSpec> macros = new HashMap<>();
		Map<String, EnvironmentSpec> environments = new HashMap<>();
		Map<String, SpecialsSpec> specials = new HashMap<>();
		int maxLength = 0;
		for (ContextCategory category : categories) {
			macros.putAll(category.getMacros());
			environments.putAll(category.getEnvironments());
			specials.putAll(category.getSpecials());
			for (String chars : category.getSpecials().keySet()) {
				maxLength = Integer.max(maxLength, chars.length());
			}
		}
		macroLookup = macros;
		environmentLookup = environments;
		specialsLookup = specials;
		maxSpecialsLength = maxLength;
	}

	private void checkNotFrozen() {
		if (frozen) {
			throw new IllegalStateException("context database is frozen");
		}
	}

	public void setUnknownMacroSpec(MacroSpec spec) {
		checkNotFrozen();
		unknownMacroSpec = spec;
	}

	public void setUnknownEnvironmentSpec(EnvironmentSpec spec) {
		checkNotFrozen();
		unknownEnvironmentSpec = spec;
	}

	public void setUnknownSpecialsSpec(SpecialsSpec spec) {
		checkNotFrozen();
		unknownSpecialsSpec = spec;
	}

	public MacroSpec getUnknownMacroSpec() {
		return unknownMacroSpec;
	}

	public EnvironmentSpec getUnknownEnvironmentSpec() {
		return unknownEnvironmentSpec;
	}

	public SpecialsSpec getUnknownSpecialsSpec() {
		return unknownSpecialsSpec;
	}

	public void freeze() {
		frozen = true;
	}

	public boolean isFrozen() {
		return frozen;
	}

	public List<String> categories() {
		List<String> names = new ArrayList<>();
		for (ContextCategory category : categories) {
			names.add(category.getName());
		}
		return names;
	}

	public ContextCategory getCategory(String name) {
		return categories.get(requireCategoryIndex(name));
	}

	/**
	 * @return the spec registered for the macro, or null; the fallback spec is not consulted
	 */
	public MacroSpec findMacroSpec(String name) {
		return macroLookup.get(name);
	}

	public EnvironmentSpec findEnvironmentSpec(String name) {
		return environmentLookup.get(name);
	}

	public SpecialsSpec findSpecialsSpec(String chars) {
		return specialsLookup.get(chars);
	}

	public MacroSpec getMacroSpec(String name) throws UnknownConstructException {
		MacroSpec spec = macroLookup.get(name);
		if (spec == null) {
			spec = unknownMacroSpec;
		}
		if (spec == null) {
			throw new UnknownConstructException(ConstructKind.MACRO, name);
		}
		return spec;
	}

	public EnvironmentSpec getEnvironmentSpec(String name) throws UnknownConstructException {
		EnvironmentSpec spec = environmentLookup.get(name);
		if (spec == null) {
			spec = unknownEnvironmentSpec;
		}
		if (spec == null) {
			throw new UnknownConstructException(ConstructKind.ENVIRONMENT, name);
		}
		return spec;
	}

	public SpecialsSpec getSpecialsSpec(String chars) throws UnknownConstructException {
		SpecialsSpec spec = specialsLookup.get(chars);
		if (spec == null) {
			spec = unknownSpecialsSpec;
		}
		if (spec == null) {
			throw new UnknownConstructException(ConstructKind.SPECIALS, chars);
		}
		return spec;
	}

	/**
	 * Finds the longest registered specials sequence starting at {@code pos}.
	 *
	 * @return the matching spec, or null if no specials sequence starts there
	 */
	public SpecialsSpec testForSpecials(CharSequence s, int pos) {
		int available = s.length() - pos;
		for (int length = Integer.min(maxSpecialsLength, available); length > 0; --length) {
			SpecialsSpec spec = specialsLookup.get(s.subSequence(pos, pos + length).toString());
			if (spec != null) {
				return spec;
			}
		}
		return null;
	}

	/**
	 * @param categories the categories to include, or null for all of them
	 */
	public List<MacroSpec> iterMacroSpecs(Collection<String> categories) {
		List<MacroSpec> specs = new ArrayList<>();
		for (ContextCategory category : selectCategories(categories)) {
			specs.addAll(category.getMacros().values());
		}
		return specs;
	}

	public List<EnvironmentSpec> iterEnvironmentSpecs(Collection<String> categories) {
		List<EnvironmentSpec> specs = new ArrayList<>();
		for (ContextCategory category : selectCategories(categories)) {
			specs.addAll(category.getEnvironments().values());
		}
		return specs;
	}

	public List<SpecialsSpec> iterSpecialsSpecs(Collection<String> categories) {
		List<SpecialsSpec> specs = new ArrayList<>();
		for (ContextCategory category : selectCategories(categories)) {
			specs.addAll(category.getSpecials().values());
		}
		return specs;
	}

	private List<ContextCategory> selectCategories(Collection<String> names) {
		if (names == null) {
			return categories;
		}
		List<ContextCategory> selected = new ArrayList<>();
		for (ContextCategory category : categories) {
			if (names.contains(category.getName())) {
				selected.add(category);
			}
		}
		return selected;
	}

	/**
	 * Derives a frozen database holding a subset of this one's categories. This database is left
	 * unchanged.
	 *
	 * @param keepCategories categories to keep, or null to keep all
	 * @param excludeCategories categories to drop, or null to drop none
	 * @param keepWhich which kinds of specs to keep, or null for all kinds
	 */
	public LatexContextDb filteredContext(Collection<String> keepCategories, Collection<String> excludeCategories,
	                                      Set<ConstructKind> keepWhich) {
		Set<ConstructKind> kinds = keepWhich == null ? EnumSet.allOf(ConstructKind.class) : keepWhich;
		LatexContextDb filtered = new LatexContextDb();
		for (ContextCategory category : categories) {
			if (keepCategories != null && !keepCategories.contains(category.getName())) {
				continue;
			}
			if (excludeCategories != null && excludeCategories.contains(category.getName())) {
				continue;
			}
			filtered.categories.add(category.filtered(kinds.contains(ConstructKind.MACRO),
					kinds.contains(ConstructKind.ENVIRONMENT), kinds.contains(ConstructKind.SPECIALS)));
		}
		filtered.unknownMacroSpec = unknownMacroSpec;
		filtered.unknownEnvironmentSpec = unknownEnvironmentSpec;
		filtered.unknownSpecialsSpec = unknownSpecialsSpec;
		filtered.rebuildLookups();
		filtered.freeze();
		return filtered;
	}

	/**
	 * Derives a frozen database in which the given specs take precedence over every existing
	 * category. Only frozen databases can be extended, so that the derived database never
	 * observes later changes.
	 */
	public LatexContextDb extendedWith(Collection<MacroSpec> macros, Collection<EnvironmentSpec> environments,
	                                   Collection<SpecialsSpec> specials) {
		if (!frozen) {
			throw new IllegalStateException("only frozen context databases can be extended");
		}
		LatexContextDb extended = new LatexContextDb();
		extended.categories.addAll(categories);
		extended.extensionCount = extensionCount + 1;
		extended.categories.add(new ContextCategory("<extension-" + extended.extensionCount + ">",
				macros, environments, specials));
		extended.unknownMacroSpec = unknownMacroSpec;
		extended.unknownEnvironmentSpec = unknownEnvironmentSpec;
		extended.unknownSpecialsSpec = unknownSpecialsSpec;
		extended.rebuildLookups();
		extended.freeze();
		return extended;
	}

	@Override
	public String toString() {
		return "LatexContextDb [categories=" + Collections.unmodifiableList(categories()) + ", frozen=" + frozen +
				"]";
	}
}
