package texparse.parser;

import texparse.errors.LatexParseException;
import texparse.lexer.TokenReader;
import texparse.state.ParsingState;
import texparse.walker.LatexWalker;

/**
 * The contract shared by every construct parser. A parser reads from the token reader starting
 * at its current position and returns either a value or a failure describing how to recover.
 *
 * <p>Parsers should invoke nested parsers through
 * {@link LatexWalker#parseContent(LatexParser, TokenReader, ParsingState, texparse.errors.OpenContext)},
 * which applies the tolerant-parsing policy to nested failures. A {@link LatexParseException} is
 * only ever thrown out of that method, never returned.</p>
 */
@FunctionalInterface
public interface LatexParser<T> {
	ParseResult<T> parse(LatexWalker walker, TokenReader reader, ParsingState state) throws LatexParseException;
}
