package texparse.context;

import org.junit.Before;
import org.junit.Test;
import texparse.errors.UnknownConstructException;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

public class LatexContextDbTest {

	private MacroSpec baseEmph;
	private MacroSpec extraEmph;
	private LatexContextDb db;

	@Before
	public void setUp() {
		baseEmph = new MacroSpec("emph", "{");
		extraEmph = new MacroSpec("emph", "[{");
		db = new LatexContextDb();
		db.addContextCategory("base", Arrays.asList(baseEmph, new MacroSpec("item", "[")),
				Collections.singletonList(new EnvironmentSpec("itemize")),
				Arrays.asList(new SpecialsSpec("-"), new SpecialsSpec("--"), new SpecialsSpec("&")));
	}

	private static void addMacros(LatexContextDb db, String category, LatexContextDb.Placement placement,
	                              MacroSpec... macros) {
		db.addContextCategory(category, Arrays.asList(macros), Collections.emptyList(), Collections.emptyList(),
				placement);
	}

	@Test
	public void laterCategoriesShadowEarlierOnes() {
		addMacros(db, "extra", LatexContextDb.Placement.append(), extraEmph);
		assertThat(db.findMacroSpec("emph"), is(sameInstance(extraEmph)));
		assertThat(db.categories(), is(Arrays.asList("base", "extra")));
	}

	@Test
	public void prependedCategoryHasLowestPrecedence() {
		addMacros(db, "extra", LatexContextDb.Placement.prepend(), extraEmph);
		assertThat(db.findMacroSpec("emph"), is(sameInstance(baseEmph)));
		assertThat(db.categories(), is(Arrays.asList("extra", "base")));
	}

	@Test
	public void relativePlacement() {
		addMacros(db, "last", LatexContextDb.Placement.append());
		addMacros(db, "middle", LatexContextDb.Placement.before("last"), extraEmph);
		addMacros(db, "after-base", LatexContextDb.Placement.after("base"));
		assertThat(db.categories(), is(Arrays.asList("base", "after-base", "middle", "last")));
		assertThat(db.findMacroSpec("emph"), is(sameInstance(extraEmph)));
	}

	@Test(expected = IllegalArgumentException.class)
	public void relativePlacementNeedsExistingCategory() {
		addMacros(db, "x", LatexContextDb.Placement.before("missing"));
	}

	@Test(expected = IllegalArgumentException.class)
	public void duplicateCategoryNamesAreRejected() {
		addMacros(db, "base", LatexContextDb.Placement.append());
	}

	@Test(expected = IllegalStateException.class)
	public void frozenDatabaseRejectsNewCategories() {
		db.freeze();
		addMacros(db, "extra", LatexContextDb.Placement.append(), extraEmph);
	}

	@Test(expected = IllegalStateException.class)
	public void frozenDatabaseRejectsFallbackChanges() {
		db.freeze();
		db.setUnknownMacroSpec(new MacroSpec(""));
	}

	@Test
	public void specialsUseLongestMatch() {
		assertThat(db.testForSpecials("a---b", 1).getSpecialsChars(), is("--"));
		assertThat(db.testForSpecials("a-b", 1).getSpecialsChars(), is("-"));
		assertThat(db.testForSpecials("a-", 1).getSpecialsChars(), is("-"));
		assertThat(db.testForSpecials("a&", 0), is(nullValue()));
	}

	@Test
	public void unknownLookups() throws UnknownConstructException {
		assertThat(db.findMacroSpec("nope"), is(nullValue()));
		try {
			db.getMacroSpec("nope");
			fail("expected an UnknownConstructException");
		} catch (UnknownConstructException e) {
			assertThat(e.getKind(), is(ConstructKind.MACRO));
			assertThat(e.getName(), is("nope"));
		}
		MacroSpec fallback = new MacroSpec("");
		db.setUnknownMacroSpec(fallback);
		assertThat(db.getMacroSpec("nope"), is(sameInstance(fallback)));
		assertThat(db.findMacroSpec("nope"), is(nullValue()));
	}

	@Test(expected = UnknownConstructException.class)
	public void unknownEnvironmentWithoutFallback() throws UnknownConstructException {
		db.getEnvironmentSpec("tabular");
	}

	@Test(expected = UnknownConstructException.class)
	public void unknownSpecialsWithoutFallback() throws UnknownConstructException {
		db.getSpecialsSpec("~");
	}

	@Test
	public void filteredContextKeepsOnlySelectedKinds() {
		addMacros(db, "extra", LatexContextDb.Placement.append(), extraEmph);
		db.freeze();
		LatexContextDb macrosOnly = db.filteredContext(null, Collections.singletonList("extra"),
				EnumSet.of(ConstructKind.MACRO));
		assertThat(macrosOnly.isFrozen(), is(true));
		assertThat(macrosOnly.categories(), is(Collections.singletonList("base")));
		assertThat(macrosOnly.findMacroSpec("emph"), is(sameInstance(baseEmph)));
		assertThat(macrosOnly.findEnvironmentSpec("itemize"), is(nullValue()));
		assertThat(macrosOnly.testForSpecials("--", 0), is(nullValue()));
		assertThat(db.findMacroSpec("emph"), is(sameInstance(extraEmph)));
	}

	@Test
	public void filteringIsIdempotent() {
		addMacros(db, "extra", LatexContextDb.Placement.append(), extraEmph);
		List<String> keep = Collections.singletonList("extra");
		LatexContextDb once = db.filteredContext(keep, null, null);
		LatexContextDb twice = once.filteredContext(keep, null, null);
		assertThat(twice.categories(), is(once.categories()));
		assertThat(twice.iterMacroSpecs(null), is(once.iterMacroSpecs(null)));
	}

	@Test
	public void extendedContextTakesPrecedence() {
		db.freeze();
		MacroSpec foo = new MacroSpec("foo");
		LatexContextDb extended = db.extendedWith(Arrays.asList(foo, extraEmph), Collections.emptyList(),
				Collections.singletonList(new SpecialsSpec("---")));
		assertThat(extended.isFrozen(), is(true));
		assertThat(extended.findMacroSpec("foo"), is(sameInstance(foo)));
		assertThat(extended.findMacroSpec("emph"), is(sameInstance(extraEmph)));
		assertThat(extended.testForSpecials("---", 0).getSpecialsChars(), is("---"));
		assertThat(db.findMacroSpec("foo"), is(nullValue()));
		assertThat(db.testForSpecials("---", 0).getSpecialsChars(), is("--"));
	}

	@Test(expected = IllegalStateException.class)
	public void onlyFrozenDatabasesCanBeExtended() {
		db.extendedWith(Collections.emptyList(), Collections.emptyList(), Collections.emptyList());
	}

	@Test
	public void iterationFollowsCategoryOrder() {
		addMacros(db, "extra", LatexContextDb.Placement.append(), extraEmph);
		assertThat(db.iterMacroSpecs(Collections.singletonList("extra")),
				is(Collections.<MacroSpec>singletonList(extraEmph)));
		assertThat(db.iterMacroSpecs(null).size(), is(3));
		assertThat(db.iterEnvironmentSpecs(null).size(), is(1));
		assertThat(db.iterSpecialsSpecs(Collections.singletonList("extra")).isEmpty(), is(true));
	}
}
