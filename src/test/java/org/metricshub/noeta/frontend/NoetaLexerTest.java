package org.metricshub.noeta.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.metricshub.noeta.diagnostics.ErrorCategory;

public class NoetaLexerTest {

	private static List<Token> lex(String code) {
		return new NoetaLexer(code).tokenize();
	}

	private static List<TokenType> types(String code) {
		List<TokenType> types = new ArrayList<TokenType>();
		for (Token token : lex(code)) {
			types.add(token.getType());
		}
		return types;
	}

	@Test
	public void testLoadStatementPositions() {
		List<Token> tokens = lex("load \"data.csv\" as sales");
		assertEquals(5, tokens.size());

		assertEquals(TokenType.LOAD, tokens.get(0).getType());
		assertEquals(1, tokens.get(0).getLine());
		assertEquals(1, tokens.get(0).getColumn());

		Token path = tokens.get(1);
		assertEquals(TokenType.STRING, path.getType());
		assertEquals("data.csv", path.getValue());
		assertEquals(6, path.getColumn());
		assertEquals(10, path.getLength());

		assertEquals(TokenType.AS, tokens.get(2).getType());
		assertEquals(17, tokens.get(2).getColumn());

		assertEquals(TokenType.IDENTIFIER, tokens.get(3).getType());
		assertEquals("sales", tokens.get(3).getText());
		assertEquals(20, tokens.get(3).getColumn());

		assertEquals(TokenType.EOF, tokens.get(4).getType());
	}

	@Test
	public void testKeywordsIgnoreCase() {
		List<Token> tokens = lex("SELECT Select sElEcT");
		for (int i = 0; i < 3; i++) {
			assertEquals(TokenType.SELECT, tokens.get(i).getType());
		}
		assertEquals("SELECT", tokens.get(0).getText());
	}

	@Test
	public void testIdentifiersKeepCase() {
		Token token = lex("Sales_2024").get(0);
		assertEquals(TokenType.IDENTIFIER, token.getType());
		assertEquals("Sales_2024", token.getText());
	}

	@Test
	public void testUnicodeIdentifiers() {
		List<Token> tokens = lex("describe données_2024 Ωmega");
		assertEquals(TokenType.IDENTIFIER, tokens.get(1).getType());
		assertEquals("données_2024", tokens.get(1).getText());
		assertEquals(10, tokens.get(1).getColumn());
		assertEquals("Ωmega", tokens.get(2).getText());
		assertEquals(23, tokens.get(2).getColumn());
	}

	@Test
	public void testLargeIntegersKeepTheirDigits() {
		List<Token> tokens = lex("9223372036854775807 99999999999999999999999");
		assertEquals(Long.valueOf(Long.MAX_VALUE), tokens.get(0).getValue());
		assertEquals(new BigInteger("99999999999999999999999"), tokens.get(1).getValue());
	}

	@Test
	public void testNumbers() {
		List<Token> tokens = lex("42 3.14");
		assertEquals(Long.valueOf(42), tokens.get(0).getValue());
		assertEquals(Double.valueOf(3.14), tokens.get(1).getValue());
	}

	@Test
	public void testTrailingDotIsNotPartOfNumber() {
		List<Token> tokens = lex("1.");
		assertEquals(TokenType.NUMBER, tokens.get(0).getType());
		assertEquals(Long.valueOf(1), tokens.get(0).getValue());
		assertEquals(TokenType.DOT, tokens.get(1).getType());
	}

	@Test
	public void testBooleans() {
		List<Token> tokens = lex("true FALSE");
		assertEquals(TokenType.BOOLEAN, tokens.get(0).getType());
		assertEquals(Boolean.TRUE, tokens.get(0).getValue());
		assertEquals(TokenType.BOOLEAN, tokens.get(1).getType());
		assertEquals(Boolean.FALSE, tokens.get(1).getValue());
	}

	@Test
	public void testCommentsAndNewlines() {
		List<Token> tokens = lex("abc # a comment\nselect");
		assertEquals(TokenType.IDENTIFIER, tokens.get(0).getType());
		Token newline = tokens.get(1);
		assertEquals(TokenType.NEWLINE, newline.getType());
		assertEquals(1, newline.getLine());
		assertEquals(16, newline.getColumn());
		Token select = tokens.get(2);
		assertEquals(TokenType.SELECT, select.getType());
		assertEquals(2, select.getLine());
		assertEquals(1, select.getColumn());
	}

	@Test
	public void testCommentOnlyLine() {
		List<Token> tokens = lex("# only\nselect");
		assertEquals(TokenType.NEWLINE, tokens.get(0).getType());
		assertEquals(7, tokens.get(0).getColumn());
		assertEquals(TokenType.SELECT, tokens.get(1).getType());
	}

	@Test
	public void testCarriageReturnsAreIgnored() {
		List<Token> tokens = lex("a\r\nb");
		assertEquals(TokenType.NEWLINE, tokens.get(1).getType());
		assertEquals(2, tokens.get(2).getLine());
		assertEquals(1, tokens.get(2).getColumn());
	}

	@Test
	public void testStringEscapes() {
		assertEquals("say \"hi\"", lex("\"say \\\"hi\\\"\"").get(0).getValue());
		// other backslashes are kept as written
		assertEquals("a\\nb", lex("\"a\\nb\"").get(0).getValue());
	}

	@Test
	public void testOperators() {
		List<TokenType> expected = new ArrayList<TokenType>();
		expected.add(TokenType.EQ);
		expected.add(TokenType.NEQ);
		expected.add(TokenType.LTE);
		expected.add(TokenType.GTE);
		expected.add(TokenType.LT);
		expected.add(TokenType.GT);
		expected.add(TokenType.DOUBLE_STAR);
		expected.add(TokenType.STAR);
		expected.add(TokenType.EQUALS);
		expected.add(TokenType.PLUS);
		expected.add(TokenType.MINUS);
		expected.add(TokenType.SLASH);
		expected.add(TokenType.PERCENT);
		expected.add(TokenType.LBRACE);
		expected.add(TokenType.RBRACE);
		expected.add(TokenType.LBRACKET);
		expected.add(TokenType.RBRACKET);
		expected.add(TokenType.LPAREN);
		expected.add(TokenType.RPAREN);
		expected.add(TokenType.COLON);
		expected.add(TokenType.COMMA);
		expected.add(TokenType.DOT);
		expected.add(TokenType.EOF);
		assertEquals(expected, types("== != <= >= < > ** * = + - / % { } [ ] ( ) : , ."));
	}

	@Test
	public void testEmptySource() {
		List<Token> tokens = lex("");
		assertEquals(1, tokens.size());
		assertEquals(TokenType.EOF, tokens.get(0).getType());
	}

	@Test
	public void testUnterminatedString() {
		LexerException e = assertThrows(LexerException.class, () -> lex("load \"data.csv as d"));
		assertEquals(ErrorCategory.LEXICAL, e.getCategory());
		assertEquals("Unterminated string literal", e.getDiagnostic().getMessage());
		assertEquals(1, e.getDiagnostic().getContext().getLine());
		assertEquals(6, e.getDiagnostic().getContext().getColumn());
		assertTrue(e.getDiagnostic().getHint().contains("closing double quote"));
	}

	@Test
	public void testUnexpectedCharacter() {
		LexerException e = assertThrows(LexerException.class, () -> lex("select d @"));
		assertEquals("Unexpected character '@'", e.getDiagnostic().getMessage());
		assertEquals(10, e.getDiagnostic().getContext().getColumn());
		assertTrue(e.getMessage().startsWith("Lexical Error at line 1, column 10:"));
	}

	@Test
	public void testSourceLine() {
		NoetaLexer lexer = new NoetaLexer("a\nb c");
		assertEquals("b c", lexer.getSourceLine(2));
		assertEquals("", lexer.getSourceLine(3));
	}
}
