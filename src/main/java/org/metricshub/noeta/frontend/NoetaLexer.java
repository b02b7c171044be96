package org.metricshub.noeta.frontend;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Noeta
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.metricshub.noeta.diagnostics.Diagnostic;
import org.metricshub.noeta.diagnostics.ErrorCategory;
import org.metricshub.noeta.util.NoetaLogger;
import org.slf4j.Logger;

/**
 * Turns Noeta program text into a list of position-tagged {@link Token}s,
 * terminated by {@link TokenType#EOF}.
 * <p>
 * Newlines are returned as {@link TokenType#NEWLINE} tokens; the grammar is
 * not line-sensitive and {@link NoetaParser} drops them. Whitespace and
 * {@code #} comments are skipped. Any character that starts no token is a
 * {@link LexerException}: nothing is silently skipped.
 */
public class NoetaLexer {

	private static final Logger LOG = NoetaLogger.getLogger(NoetaLexer.class);

	private final String source;
	private final String[] sourceLines;

	private int pos;
	private int line = 1;
	private int column = 1;
	private int c;

	private final StringBuilder text = new StringBuilder();

	/**
	 * @param source the program text
	 */
	public NoetaLexer(String source) {
		this.source = source == null ? "" : source;
		this.sourceLines = this.source.split("\r?\n", -1);
		this.c = this.source.isEmpty() ? -1 : this.source.charAt(0);
	}

	/**
	 * Tokenizes the whole program.
	 *
	 * @return the tokens, ending with {@link TokenType#EOF}
	 * @throws LexerException on an unexpected character or an unterminated string
	 */
	public List<Token> tokenize() {
		List<Token> tokens = new ArrayList<Token>();
		Token token;
		do {
			token = lexer();
			tokens.add(token);
		} while (token.getType() != TokenType.EOF);
		LOG.debug("Tokenized {} lines into {} tokens", sourceLines.length, tokens.size());
		return tokens;
	}

	/**
	 * @param lineNumber 1-based line number
	 * @return the text of that line, or an empty string when out of range
	 */
	public String getSourceLine(int lineNumber) {
		if (lineNumber < 1 || lineNumber > sourceLines.length) {
			return "";
		}
		return sourceLines[lineNumber - 1];
	}

	private void read() {
		if (c < 0) {
			return;
		}
		text.append((char) c);
		if (c == '\n') {
			line++;
			column = 1;
		} else {
			column++;
		}
		pos++;
		c = pos < source.length() ? source.charAt(pos) : -1;
		// completely bypass \r's
		while (c == '\r') {
			pos++;
			c = pos < source.length() ? source.charAt(pos) : -1;
		}
	}

	private int peek() {
		int next = pos + 1;
		return next < source.length() ? source.charAt(next) : -1;
	}

	private Token lexer() {
		// clear whitespace and comments
		while (c == ' ' || c == '\t' || c == '#' || c == '\r') {
			if (c == '#') {
				while (c >= 0 && c != '\n') {
					read();
				}
			} else {
				read();
			}
		}

		text.setLength(0);
		int startLine = line;
		int startColumn = column;

		if (c < 0) {
			return new Token(TokenType.EOF, "", null, startLine, startColumn, 0);
		}
		if (c == '\n') {
			read();
			return new Token(TokenType.NEWLINE, "\n", null, startLine, startColumn, 1);
		}
		if (c == '"') {
			return readString(startLine, startColumn);
		}
		if (isDigit(c)) {
			return readNumber(startLine, startColumn);
		}
		if (isIdentifierStart(c)) {
			while (c >= 0 && isIdentifierPart(c)) {
				read();
			}
			String word = text.toString();
			String lower = word.toLowerCase(Locale.ROOT);
			if ("true".equals(lower) || "false".equals(lower)) {
				return new Token(TokenType.BOOLEAN, word, Boolean.valueOf(lower), startLine, startColumn, word.length());
			}
			TokenType keyword = TokenType.keyword(word);
			TokenType type = keyword == null ? TokenType.IDENTIFIER : keyword;
			return new Token(type, word, word, startLine, startColumn, word.length());
		}

		// two-character operators first
		TokenType twoChars = twoCharOperator(c, peek());
		if (twoChars != null) {
			read();
			read();
			return new Token(twoChars, twoChars.getText(), null, startLine, startColumn, 2);
		}
		TokenType oneChar = oneCharOperator(c);
		if (oneChar != null) {
			read();
			return new Token(oneChar, oneChar.getText(), null, startLine, startColumn, 1);
		}

		throw lexerException("Unexpected character '" + (char) c + "'", startLine, startColumn, 1,
				"Remove or replace this character");
	}

	/**
	 * Reads a double-quoted string. Only {@code \"} is an escape; any other
	 * backslash is kept as written. Strings may span lines.
	 */
	private Token readString(int startLine, int startColumn) {
		StringBuilder string = new StringBuilder();
		// opening quote
		read();
		while (c >= 0 && c != '"') {
			if (c == '\\' && peek() == '"') {
				read();
			}
			string.append((char) c);
			read();
		}
		if (c < 0) {
			throw lexerException("Unterminated string literal", startLine, startColumn, 1,
					"Add a closing double quote (\") to end the string");
		}
		// closing quote
		read();
		int length = startLine == line ? column - startColumn : getSourceLine(startLine).length() - startColumn + 1;
		return new Token(TokenType.STRING, string.toString(), string.toString(), startLine, startColumn, length);
	}

	/**
	 * Reads {@code digits} or {@code digits.digits}. A dot not followed by a
	 * digit is left for the next token. Integers are {@link Long} values, or
	 * {@link BigInteger} values beyond the range of a long.
	 */
	private Token readNumber(int startLine, int startColumn) {
		while (isDigit(c)) {
			read();
		}
		boolean decimal = false;
		if (c == '.' && isDigit(peek())) {
			decimal = true;
			read();
			while (isDigit(c)) {
				read();
			}
		}
		String number = text.toString();
		Object value;
		if (decimal) {
			value = Double.valueOf(number);
		} else {
			BigInteger integer = new BigInteger(number);
			value = integer.bitLength() < Long.SIZE ? Long.valueOf(integer.longValue()) : integer;
		}
		return new Token(TokenType.NUMBER, number, value, startLine, startColumn, number.length());
	}

	private static TokenType twoCharOperator(int first, int second) {
		if (second < 0) {
			return null;
		}
		switch (first) {
		case '=':
			return second == '=' ? TokenType.EQ : null;
		case '!':
			return second == '=' ? TokenType.NEQ : null;
		case '<':
			return second == '=' ? TokenType.LTE : null;
		case '>':
			return second == '=' ? TokenType.GTE : null;
		case '*':
			return second == '*' ? TokenType.DOUBLE_STAR : null;
		default:
			return null;
		}
	}

	private static TokenType oneCharOperator(int ch) {
		switch (ch) {
		case '=':
			return TokenType.EQUALS;
		case '<':
			return TokenType.LT;
		case '>':
			return TokenType.GT;
		case '+':
			return TokenType.PLUS;
		case '-':
			return TokenType.MINUS;
		case '*':
			return TokenType.STAR;
		case '/':
			return TokenType.SLASH;
		case '%':
			return TokenType.PERCENT;
		case '(':
			return TokenType.LPAREN;
		case ')':
			return TokenType.RPAREN;
		case '{':
			return TokenType.LBRACE;
		case '}':
			return TokenType.RBRACE;
		case '[':
			return TokenType.LBRACKET;
		case ']':
			return TokenType.RBRACKET;
		case ':':
			return TokenType.COLON;
		case ',':
			return TokenType.COMMA;
		case '.':
			return TokenType.DOT;
		default:
			return null;
		}
	}

	private static boolean isDigit(int ch) {
		return ch >= '0' && ch <= '9';
	}

	/**
	 * Identifiers may use any Unicode letter, so that aliases such as
	 * {@code données} are valid names.
	 */
	private static boolean isIdentifierStart(int ch) {
		return ch >= 0 && (Character.isLetter(ch) || ch == '_');
	}

	private static boolean isIdentifierPart(int ch) {
		return ch >= 0 && (Character.isLetterOrDigit(ch) || ch == '_');
	}

	private LexerException lexerException(String message, int errorLine, int errorColumn, int length, String hint) {
		return new LexerException(
				Diagnostic
						.builder(ErrorCategory.LEXICAL, message)
						.at(errorLine, errorColumn, length, getSourceLine(errorLine))
						.hint(hint)
						.build());
	}
}
