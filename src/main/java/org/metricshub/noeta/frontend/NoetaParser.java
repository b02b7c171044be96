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
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.metricshub.noeta.diagnostics.Diagnostic;
import org.metricshub.noeta.diagnostics.ErrorCategory;
import org.metricshub.noeta.diagnostics.Suggestions;
import org.metricshub.noeta.frontend.StatementContract.Clause;
import org.metricshub.noeta.frontend.StatementContract.Family;
import org.metricshub.noeta.frontend.ast.Aggregation;
import org.metricshub.noeta.frontend.ast.Condition;
import org.metricshub.noeta.frontend.ast.Expression;
import org.metricshub.noeta.frontend.ast.Mutation;
import org.metricshub.noeta.frontend.ast.Parameter;
import org.metricshub.noeta.frontend.ast.Program;
import org.metricshub.noeta.frontend.ast.Reference;
import org.metricshub.noeta.frontend.ast.SortKey;
import org.metricshub.noeta.frontend.ast.SourcePosition;
import org.metricshub.noeta.frontend.ast.Statement;
import org.metricshub.noeta.frontend.ast.StatementKind;
import org.metricshub.noeta.util.NoetaLogger;
import org.slf4j.Logger;

/**
 * Recursive descent parser for Noeta programs.
 * <p>
 * The next token's kind selects one routine in a flat table (one entry per
 * statement keyword, each pointing at the routine of its grammar
 * {@link Family}); the routine reads the source datasets, then the clauses
 * the kind's {@link StatementContract} accepts, then an optional
 * {@code as alias}. Filter conditions and transform expressions have their
 * own precedence-climbing sub-grammars.
 * <p>
 * The first syntax error aborts the parse with a {@link ParserException}.
 */
public class NoetaParser {

	private static final Logger LOG = NoetaLogger.getLogger(NoetaParser.class);

	/**
	 * Parsing routine of one grammar family.
	 */
	private interface StatementRoutine {
		Statement parse(Token keyword, StatementContract contract);
	}

	private final List<Token> tokens;
	private final String[] sourceLines;
	private final Map<StatementKind, StatementRoutine> routines = new EnumMap<StatementKind, StatementRoutine>(
			StatementKind.class);

	private int pos;
	private Token token;
	private Token previous;

	// statement being parsed, for error messages
	private StatementContract current;

	/**
	 * @param tokens tokens from {@link NoetaLexer#tokenize()}; newlines are dropped
	 * @param source the program text, to quote source lines in diagnostics
	 */
	public NoetaParser(List<Token> tokens, String source) {
		List<Token> filtered = new ArrayList<Token>(tokens.size());
		for (Token t : tokens) {
			if (t.getType() != TokenType.NEWLINE) {
				filtered.add(t);
			}
		}
		if (filtered.isEmpty() || !filtered.get(filtered.size() - 1).is(TokenType.EOF)) {
			Token last = filtered.isEmpty() ? null : filtered.get(filtered.size() - 1);
			filtered.add(new Token(TokenType.EOF, "", null, last == null ? 1 : last.getLine(),
					last == null ? 1 : last.getColumn() + last.getLength(), 0));
		}
		this.tokens = filtered;
		this.sourceLines = source == null ? new String[0] : source.split("\r?\n", -1);
		this.token = filtered.get(0);

		Map<Family, StatementRoutine> families = new EnumMap<Family, StatementRoutine>(Family.class);
		families.put(Family.LOAD, this::LOAD_STATEMENT);
		families.put(Family.SAVE, this::SAVE_STATEMENT);
		families.put(Family.NO_SOURCE, this::NO_SOURCE_STATEMENT);
		families.put(Family.SELECT, this::SELECT_STATEMENT);
		families.put(Family.SORT, this::SORT_STATEMENT);
		families.put(Family.GROUPBY, this::GROUPBY_STATEMENT);
		families.put(Family.MUTATE, this::MUTATE_STATEMENT);
		families.put(Family.BINARY, this::BINARY_STATEMENT);
		families.put(Family.MULTI, this::MULTI_STATEMENT);
		families.put(Family.HYPOTHESIS, this::HYPOTHESIS_STATEMENT);
		families.put(Family.GENERIC, this::GENERIC_STATEMENT);
		for (StatementKind kind : StatementKind.values()) {
			routines.put(kind, families.get(StatementContract.of(kind).getFamily()));
		}
	}

	/**
	 * Parses the whole token list.
	 *
	 * @return the program
	 * @throws ParserException on the first syntax error
	 */
	public Program parse() {
		List<Statement> statements = new ArrayList<Statement>();
		while (!token.is(TokenType.EOF)) {
			statements.add(STATEMENT());
		}
		LOG.debug("Parsed {} statements", statements.size());
		return new Program(statements);
	}

	// token stream
	// ===============================================================================

	private Token advance() {
		previous = token;
		if (pos < tokens.size() - 1) {
			pos++;
		}
		token = tokens.get(pos);
		return previous;
	}

	private Token peek() {
		return pos + 1 < tokens.size() ? tokens.get(pos + 1) : tokens.get(tokens.size() - 1);
	}

	private boolean optional(TokenType type) {
		if (token.is(type)) {
			advance();
			return true;
		}
		return false;
	}

	private Token expect(TokenType type) {
		if (!token.is(type)) {
			throw mismatch(type.getDescription());
		}
		return advance();
	}

	private static SourcePosition positionOf(Token t) {
		return new SourcePosition(t.getLine(), t.getColumn());
	}

	private static Reference referenceOf(Token t) {
		return new Reference(t.getText(), positionOf(t), t.getLength());
	}

	private static String nameOf(Token t) {
		return t.getType().isKeyword() ? t.getText().toLowerCase(Locale.ROOT) : t.getText();
	}

	// CHECKSTYLE.OFF MethodName

	// STATEMENT : statement_keyword ...
	private Statement STATEMENT() {
		if (!token.getType().isStatementKeyword()) {
			String suggestion = null;
			if (token.is(TokenType.IDENTIFIER)) {
				suggestion = Suggestions.nearest(token.getText(), TokenType.statementKeywords());
			}
			throw parserException(
					"Unexpected " + token.describe() + " at start of statement",
					token,
					"Each statement must start with an operation keyword such as load, select or filter",
					suggestion);
		}
		StatementKind kind = StatementKind.of(token.getType());
		StatementRoutine routine = routines.get(kind);
		if (routine == null) {
			throw new IllegalStateException("No parsing routine for " + kind);
		}
		current = StatementContract.of(kind);
		Token keyword = advance();
		Statement statement = routine.parse(keyword, current);
		current = null;
		return statement;
	}

	// LOAD : load [csv|json|excel|parquet] "path" CLAUSES as alias | load sql "query" from "connection" CLAUSES as alias
	private Statement LOAD_STATEMENT(Token keyword, StatementContract contract) {
		Statement statement = new Statement(contract.getKind(), positionOf(keyword));
		if (token.is(TokenType.SQL)) {
			advance();
			statement.setFormat("sql");
			statement.setPath(expect(TokenType.STRING).getText());
			expect(TokenType.FROM);
			statement.setConnection(expect(TokenType.STRING).getText());
		} else {
			if (token.is(TokenType.CSV) || token.is(TokenType.JSON) || token.is(TokenType.EXCEL)
					|| token.is(TokenType.PARQUET)) {
				statement.setFormat(nameOf(advance()));
			}
			statement.setPath(expect(TokenType.STRING).getText());
			if (statement.getFormat() == null) {
				statement.setFormat(detectFormat(statement.getPath()));
			}
		}
		CLAUSES(statement, contract);
		return TRAILER(statement, contract, true);
	}

	// SAVE : save alias to "path" CLAUSES
	private Statement SAVE_STATEMENT(Token keyword, StatementContract contract) {
		Statement statement = new Statement(contract.getKind(), positionOf(keyword));
		statement.addSource(NAME());
		expect(TokenType.TO);
		statement.setPath(expect(TokenType.STRING).getText());
		CLAUSES(statement, contract);
		Object format = statement.getValue("format");
		statement.setFormat(format == null ? detectFormat(statement.getPath()) : format.toString().toLowerCase(Locale.ROOT));
		return TRAILER(statement, contract, false);
	}

	// NO_SOURCE : keyword CLAUSES
	private Statement NO_SOURCE_STATEMENT(Token keyword, StatementContract contract) {
		Statement statement = new Statement(contract.getKind(), positionOf(keyword));
		CLAUSES(statement, contract);
		return TRAILER(statement, contract, false);
	}

	// SELECT : select alias ( {c1, c2} | with c1, c2 ) [as alias]
	private Statement SELECT_STATEMENT(Token keyword, StatementContract contract) {
		Statement statement = new Statement(contract.getKind(), positionOf(keyword));
		statement.addSource(NAME());
		List<Reference> columns;
		if (token.is(TokenType.LBRACE)) {
			columns = NAME_LIST();
		} else {
			expect(TokenType.WITH);
			columns = NATURAL_NAME_LIST();
		}
		for (Reference column : columns) {
			statement.addColumn(column);
		}
		CLAUSES(statement, contract);
		return TRAILER(statement, contract, false);
	}

	// SORT : sort alias by c1 [asc|desc] (, c2 [asc|desc])* CLAUSES [as alias]
	private Statement SORT_STATEMENT(Token keyword, StatementContract contract) {
		Statement statement = new Statement(contract.getKind(), positionOf(keyword));
		statement.addSource(NAME());
		expect(TokenType.BY);
		do {
			Reference column = NAME_OR_STRING();
			boolean descending = false;
			if (token.is(TokenType.DESC)) {
				advance();
				descending = true;
			} else {
				optional(TokenType.ASC);
			}
			statement.addSortKey(new SortKey(column, descending));
		} while (optional(TokenType.COMMA));
		CLAUSES(statement, contract);
		return TRAILER(statement, contract, false);
	}

	// GROUPBY : groupby alias by ({c1, c2} | c1, c2) [(compute|agg) {func: col, ...}] CLAUSES [as alias]
	private Statement GROUPBY_STATEMENT(Token keyword, StatementContract contract) {
		Statement statement = new Statement(contract.getKind(), positionOf(keyword));
		statement.addSource(NAME());
		expect(TokenType.BY);
		for (Reference column : token.is(TokenType.LBRACE) ? NAME_LIST() : NATURAL_NAME_LIST()) {
			statement.addGroupBy(column);
		}
		if (token.is(TokenType.COMPUTE) || token.is(TokenType.AGG)) {
			advance();
			expect(TokenType.LBRACE);
			do {
				if (token.is(TokenType.RBRACE)) {
					break;
				}
				String function = nameOf(NAME_TOKEN());
				expect(TokenType.COLON);
				statement.addAggregation(new Aggregation(function, NAME_OR_STRING()));
			} while (optional(TokenType.COMMA));
			expect(TokenType.RBRACE);
		}
		CLAUSES(statement, contract);
		return TRAILER(statement, contract, false);
	}

	// MUTATE : mutate alias (with col = EXPRESSION)+ CLAUSES [as alias] | mutate alias {col: "expr", ...} CLAUSES [as alias]
	private Statement MUTATE_STATEMENT(Token keyword, StatementContract contract) {
		Statement statement = new Statement(contract.getKind(), positionOf(keyword));
		statement.addSource(NAME());
		if (token.is(TokenType.LBRACE)) {
			advance();
			do {
				if (token.is(TokenType.RBRACE)) {
					break;
				}
				Reference column = NAME_OR_STRING();
				expect(TokenType.COLON);
				statement.addMutation(Mutation.ofText(column, expect(TokenType.STRING).getText()));
			} while (optional(TokenType.COMMA));
			expect(TokenType.RBRACE);
		} else {
			expect(TokenType.WITH);
			do {
				Reference column = NAME();
				expect(TokenType.EQUALS);
				statement.addMutation(Mutation.of(column, EXPRESSION()));
			} while (optional(TokenType.WITH));
		}
		CLAUSES(statement, contract);
		return TRAILER(statement, contract, false);
	}

	// BINARY : keyword alias with alias CLAUSES [as alias]
	private Statement BINARY_STATEMENT(Token keyword, StatementContract contract) {
		Statement statement = new Statement(contract.getKind(), positionOf(keyword));
		statement.addSource(NAME());
		expect(TokenType.WITH);
		statement.addSource(NAME());
		CLAUSES(statement, contract);
		return TRAILER(statement, contract, false);
	}

	// MULTI : keyword [alias, alias, ...] CLAUSES [as alias]
	private Statement MULTI_STATEMENT(Token keyword, StatementContract contract) {
		Statement statement = new Statement(contract.getKind(), positionOf(keyword));
		expect(TokenType.LBRACKET);
		do {
			if (token.is(TokenType.RBRACKET)) {
				break;
			}
			statement.addSource(NAME());
		} while (optional(TokenType.COMMA));
		expect(TokenType.RBRACKET);
		if (statement.getSources().isEmpty()) {
			throw parserException("At least one dataset is required in " + contract.getKind().describe(), previous,
					hint(contract), null);
		}
		CLAUSES(statement, contract);
		return TRAILER(statement, contract, false);
	}

	// HYPOTHESIS : hypothesis alias vs[:] alias CLAUSES
	private Statement HYPOTHESIS_STATEMENT(Token keyword, StatementContract contract) {
		Statement statement = new Statement(contract.getKind(), positionOf(keyword));
		statement.addSource(NAME());
		expect(TokenType.VS);
		optional(TokenType.COLON);
		statement.addSource(NAME());
		CLAUSES(statement, contract);
		return TRAILER(statement, contract, false);
	}

	// GENERIC : keyword alias CLAUSES [as alias]
	private Statement GENERIC_STATEMENT(Token keyword, StatementContract contract) {
		Statement statement = new Statement(contract.getKind(), positionOf(keyword));
		statement.addSource(NAME());
		CLAUSES(statement, contract);
		return TRAILER(statement, contract, false);
	}

	// CLAUSES : (with | COLUMN_CLAUSE | COLUMNS_CLAUSE | by LIST | on NAME | where CONDITION | PARAMETER [,] | flag)*
	private void CLAUSES(Statement statement, StatementContract contract) {
		while (!token.is(TokenType.AS) && !token.is(TokenType.EOF)) {
			if (token.is(TokenType.WITH)) {
				WITH_CLAUSE(statement, contract);
			} else if (token.is(TokenType.COLUMN) && contract.accepts(Clause.COLUMN)) {
				advance();
				skipAssignment();
				statement.setColumn(NAME_OR_STRING());
			} else if (token.is(TokenType.COLUMNS) && contract.isColumnsParameter()) {
				PARAMETER(statement, contract);
			} else if (token.is(TokenType.COLUMNS) && contract.accepts(Clause.COLUMNS)) {
				advance();
				skipAssignment();
				for (Reference column : LIST()) {
					statement.addColumn(column);
				}
			} else if (token.is(TokenType.BY) && contract.accepts(Clause.BY)) {
				advance();
				for (Reference column : LIST()) {
					statement.addGroupBy(column);
				}
			} else if (token.is(TokenType.ON) && contract.accepts(Clause.ON)) {
				advance();
				optional(TokenType.EQUALS);
				statement.addGroupBy(NAME_OR_STRING());
			} else if (token.is(TokenType.WHERE) && contract.accepts(Clause.WHERE)) {
				advance();
				statement.setWhere(CONDITION());
			} else if (isFlag(contract)) {
				Token flag = advance();
				statement.putParameter(new Parameter(nameOf(flag), Boolean.TRUE, positionOf(flag), flag.getLength()));
			} else if (isParameterStart()) {
				PARAMETER(statement, contract);
				// parameters may be separated by commas
				optional(TokenType.COMMA);
			} else if (token.getType().isStatementKeyword()) {
				// next statement
				return;
			} else {
				throw mismatch(TokenType.AS.getDescription());
			}
		}
	}

	// WITH_CLAUSE : with transform EXPRESSION | with c1, c2 | with PARAMETER+
	private void WITH_CLAUSE(Statement statement, StatementContract contract) {
		advance();
		if (token.is(TokenType.TRANSFORM) && contract.accepts(Clause.TRANSFORM)) {
			advance();
			statement.setTransform(EXPRESSION());
			return;
		}
		if (contract.accepts(Clause.WITH_COLUMNS) && token.isName() && !isParameterStart()) {
			for (Reference column : NATURAL_NAME_LIST()) {
				statement.addColumn(column);
			}
			return;
		}
		if (!isParameterStart() && !isFlag(contract) && !isClauseStart(contract)) {
			throw mismatch("parameter (name=value)");
		}
	}

	// PARAMETER : name (= | :) VALUE | name ({...} | [...])
	private void PARAMETER(Statement statement, StatementContract contract) {
		Token nameToken = advance();
		String name = nameOf(nameToken);
		if (!contract.acceptsParameter(name)) {
			throw unknownParameter(nameToken, name, contract);
		}
		if (!optional(TokenType.EQUALS)) {
			optional(TokenType.COLON);
		}
		Token valueToken = token;
		Object value = VALUE();
		statement.putParameter(new Parameter(name, value, positionOf(valueToken), valueToken.getLength()));
	}

	// TRAILER : [as alias], then the contract checks
	private Statement TRAILER(Statement statement, StatementContract contract, boolean aliasRequired) {
		for (Clause clause : Clause.values()) {
			if (contract.requires(clause) && !isPresent(statement, clause)) {
				throw mismatch(clauseDescription(clause));
			}
		}
		for (String name : contract.getRequiredParameters()) {
			if (!statement.hasParameter(name)) {
				throw parserException(
						"Missing required parameter '" + name + "' in " + contract.getKind().describe(),
						token.is(TokenType.EOF) && previous != null ? previous : token,
						hint(contract),
						null);
			}
		}
		if (aliasRequired) {
			expect(TokenType.AS);
			statement.setResultAlias(NAME());
		} else if (token.is(TokenType.AS)) {
			if (!contract.isBindable()) {
				throw parserException(
						contract.getKind().describe() + " does not produce a dataset and cannot be bound with 'as'",
						token,
						"Remove the 'as' clause",
						null);
			}
			advance();
			statement.setResultAlias(NAME());
		}
		return statement;
	}

	// NAME : identifier or keyword
	private Reference NAME() {
		return referenceOf(NAME_TOKEN());
	}

	private Token NAME_TOKEN() {
		if (!token.isName()) {
			throw mismatch(TokenType.IDENTIFIER.getDescription());
		}
		return advance();
	}

	// NAME_OR_STRING : NAME | "name"
	private Reference NAME_OR_STRING() {
		if (token.is(TokenType.STRING)) {
			return referenceOf(advance());
		}
		return NAME();
	}

	// NAME_LIST : { NAME_OR_STRING, ... } | [ NAME_OR_STRING, ... ]
	private List<Reference> NAME_LIST() {
		TokenType closing = token.is(TokenType.LBRACE) ? TokenType.RBRACE : TokenType.RBRACKET;
		advance();
		List<Reference> names = new ArrayList<Reference>();
		do {
			if (token.is(closing)) {
				break;
			}
			names.add(NAME_OR_STRING());
		} while (optional(TokenType.COMMA));
		expect(closing);
		return names;
	}

	// NATURAL_NAME_LIST : NAME_OR_STRING (, NAME_OR_STRING)*
	private List<Reference> NATURAL_NAME_LIST() {
		List<Reference> names = new ArrayList<Reference>();
		do {
			names.add(NAME_OR_STRING());
		} while (optional(TokenType.COMMA));
		return names;
	}

	// LIST : NAME_LIST | NATURAL_NAME_LIST
	private List<Reference> LIST() {
		if (token.is(TokenType.LBRACE) || token.is(TokenType.LBRACKET)) {
			return NAME_LIST();
		}
		return NATURAL_NAME_LIST();
	}

	// VALUE : string | [-]number | boolean | null | name | [ VALUE, ... ] | { key: VALUE, ... }
	private Object VALUE() {
		switch (token.getType()) {
		case STRING:
		case BOOLEAN:
		case NUMBER:
			return advance().getValue();
		case MINUS:
			advance();
			return negate(expect(TokenType.NUMBER).getValue());
		case NULL:
			advance();
			return null;
		case LBRACKET:
			return LIST_VALUE();
		case LBRACE:
			advance();
			Map<String, Object> map = new LinkedHashMap<String, Object>();
			while (!token.is(TokenType.RBRACE)) {
				String key = token.is(TokenType.STRING) ? advance().getText() : nameOf(NAME_TOKEN());
				expect(TokenType.COLON);
				map.put(key, VALUE());
				if (!optional(TokenType.COMMA)) {
					break;
				}
			}
			expect(TokenType.RBRACE);
			return Collections.unmodifiableMap(map);
		default:
			if (token.isName()) {
				String word = advance().getText();
				return "none".equalsIgnoreCase(word) ? null : word;
			}
			throw mismatch("value");
		}
	}

	// LIST_VALUE : [ VALUE, ... ]
	private List<Object> LIST_VALUE() {
		expect(TokenType.LBRACKET);
		List<Object> list = new ArrayList<Object>();
		while (!token.is(TokenType.RBRACKET)) {
			list.add(VALUE());
			if (!optional(TokenType.COMMA)) {
				break;
			}
		}
		expect(TokenType.RBRACKET);
		return Collections.unmodifiableList(list);
	}

	// CONDITION : OR_CONDITION
	// OR_CONDITION : AND_CONDITION (or AND_CONDITION)*
	private Condition CONDITION() {
		Condition left = AND_CONDITION();
		while (optional(TokenType.OR)) {
			left = Condition.or(left, AND_CONDITION());
		}
		return left;
	}

	// AND_CONDITION : NOT_CONDITION (and NOT_CONDITION)*
	private Condition AND_CONDITION() {
		Condition left = NOT_CONDITION();
		while (optional(TokenType.AND)) {
			left = Condition.and(left, NOT_CONDITION());
		}
		return left;
	}

	// NOT_CONDITION : not NOT_CONDITION | CONDITION_ATOM
	private Condition NOT_CONDITION() {
		if (token.is(TokenType.NOT)) {
			Token not = advance();
			return Condition.not(NOT_CONDITION(), positionOf(not));
		}
		return CONDITION_ATOM();
	}

	// CONDITION_ATOM : ( CONDITION ) | column (between v and v | in [..] | contains "s" | ... | is [not] null | cmp VALUE)
	private Condition CONDITION_ATOM() {
		if (optional(TokenType.LPAREN)) {
			Condition inner = CONDITION();
			expect(TokenType.RPAREN);
			return inner;
		}
		Reference column = NAME_OR_STRING();
		switch (token.getType()) {
		case BETWEEN:
			advance();
			Object low = VALUE();
			expect(TokenType.AND);
			return Condition.between(column, low, VALUE());
		case IN:
			advance();
			if (!token.is(TokenType.LBRACKET)) {
				throw mismatch(TokenType.LBRACKET.getDescription());
			}
			return Condition.in(column, LIST_VALUE());
		case CONTAINS:
		case STARTS_WITH:
		case ENDS_WITH:
		case MATCHES:
			String operator = nameOf(advance());
			return Condition.stringMatch(column, operator, expect(TokenType.STRING).getText());
		case IS:
			advance();
			boolean negated = optional(TokenType.NOT);
			expect(TokenType.NULL);
			return Condition.nullCheck(column, negated);
		case EQ:
		case EQUALS:
			advance();
			return Condition.comparison(column, "==", VALUE());
		case NEQ:
		case LT:
		case GT:
		case LTE:
		case GTE:
			return Condition.comparison(column, advance().getType().getText(), VALUE());
		default:
			throw mismatch("comparison operator");
		}
	}

	// EXPRESSION : OR_EXPRESSION [where OR_EXPRESSION else EXPRESSION]
	private Expression EXPRESSION() {
		Expression value = OR_EXPRESSION();
		if (optional(TokenType.WHERE)) {
			Expression condition = OR_EXPRESSION();
			expect(TokenType.ELSE);
			return Expression.conditional(value, condition, EXPRESSION());
		}
		return value;
	}

	// OR_EXPRESSION : AND_EXPRESSION (or AND_EXPRESSION)*
	private Expression OR_EXPRESSION() {
		Expression left = AND_EXPRESSION();
		while (optional(TokenType.OR)) {
			left = Expression.binary(left, "or", AND_EXPRESSION());
		}
		return left;
	}

	// AND_EXPRESSION : COMPARISON (and COMPARISON)*
	private Expression AND_EXPRESSION() {
		Expression left = COMPARISON();
		while (optional(TokenType.AND)) {
			left = Expression.binary(left, "and", COMPARISON());
		}
		return left;
	}

	// COMPARISON : ADDITIVE [cmp ADDITIVE]
	private Expression COMPARISON() {
		Expression left = ADDITIVE();
		switch (token.getType()) {
		case EQ:
		case NEQ:
		case LT:
		case GT:
		case LTE:
		case GTE:
			String operator = advance().getType().getText();
			return Expression.binary(left, operator, ADDITIVE());
		default:
			return left;
		}
	}

	// ADDITIVE : MULTIPLICATIVE ((+|-) MULTIPLICATIVE)*
	private Expression ADDITIVE() {
		Expression left = MULTIPLICATIVE();
		while (token.is(TokenType.PLUS) || token.is(TokenType.MINUS)) {
			String operator = advance().getType().getText();
			left = Expression.binary(left, operator, MULTIPLICATIVE());
		}
		return left;
	}

	// MULTIPLICATIVE : POWER ((*|/|%) POWER)*
	private Expression MULTIPLICATIVE() {
		Expression left = POWER();
		while (token.is(TokenType.STAR) || token.is(TokenType.SLASH) || token.is(TokenType.PERCENT)) {
			String operator = advance().getType().getText();
			left = Expression.binary(left, operator, POWER());
		}
		return left;
	}

	// POWER : UNARY [** POWER]
	private Expression POWER() {
		Expression base = UNARY();
		if (optional(TokenType.DOUBLE_STAR)) {
			return Expression.binary(base, "**", POWER());
		}
		return base;
	}

	// UNARY : (- | not) UNARY | PRIMARY
	private Expression UNARY() {
		if (token.is(TokenType.MINUS)) {
			Token minus = advance();
			return Expression.unary("-", UNARY(), positionOf(minus));
		}
		if (token.is(TokenType.NOT)) {
			Token not = advance();
			return Expression.unary("not", UNARY(), positionOf(not));
		}
		return PRIMARY();
	}

	// PRIMARY : number | string | boolean | null | name [ ( args ) ] | ( EXPRESSION )
	private Expression PRIMARY() {
		Token start = token;
		switch (token.getType()) {
		case NUMBER:
		case STRING:
		case BOOLEAN:
			return Expression.literal(advance().getValue(), positionOf(start));
		case NULL:
			advance();
			return Expression.literal(null, positionOf(start));
		case LPAREN:
			advance();
			Expression inner = EXPRESSION();
			expect(TokenType.RPAREN);
			return inner;
		default:
			break;
		}
		if (token.is(TokenType.IDENTIFIER) || token.getType().isStatementKeyword()
				|| (token.isName() && peek().is(TokenType.LPAREN))) {
			advance();
			if (optional(TokenType.LPAREN)) {
				List<Expression> arguments = new ArrayList<Expression>();
				if (!token.is(TokenType.RPAREN)) {
					do {
						arguments.add(EXPRESSION());
					} while (optional(TokenType.COMMA));
				}
				expect(TokenType.RPAREN);
				return Expression.call(nameOf(start), arguments, positionOf(start));
			}
			return Expression.identifier(start.getText(), positionOf(start));
		}
		throw mismatch("expression");
	}

	// CHECKSTYLE.ON MethodName

	// helpers
	// ===============================================================================

	private void skipAssignment() {
		if (!optional(TokenType.EQUALS)) {
			optional(TokenType.COLON);
		}
	}

	private boolean isParameterStart() {
		if (!token.isName()) {
			return false;
		}
		Token next = peek();
		if (next.is(TokenType.EQUALS) || next.is(TokenType.COLON)) {
			return true;
		}
		return token.is(TokenType.IDENTIFIER) && (next.is(TokenType.LBRACE) || next.is(TokenType.LBRACKET));
	}

	private boolean isFlag(StatementContract contract) {
		if (!token.isName() || !contract.isFlag(nameOf(token))) {
			return false;
		}
		Token next = peek();
		if (next.is(TokenType.EQUALS) || next.is(TokenType.COLON)) {
			return false;
		}
		if (!token.getType().isStatementKeyword()) {
			return true;
		}
		// a statement keyword followed by a dataset name starts the next statement
		if (next.is(TokenType.IDENTIFIER)) {
			return contract.isFlag(next.getText());
		}
		return !next.is(TokenType.LBRACKET);
	}

	private boolean isClauseStart(StatementContract contract) {
		switch (token.getType()) {
		case COLUMN:
			return contract.accepts(Clause.COLUMN);
		case COLUMNS:
			return contract.accepts(Clause.COLUMNS) || contract.isColumnsParameter();
		case BY:
			return contract.accepts(Clause.BY);
		case ON:
			return contract.accepts(Clause.ON);
		case WHERE:
			return contract.accepts(Clause.WHERE);
		default:
			return false;
		}
	}

	private static boolean isPresent(Statement statement, Clause clause) {
		switch (clause) {
		case COLUMN:
			return statement.getColumn() != null;
		case COLUMNS:
		case WITH_COLUMNS:
			return !statement.getColumns().isEmpty();
		case BY:
		case ON:
			return !statement.getGroupBy().isEmpty();
		case WHERE:
			return statement.getWhere() != null;
		case TRANSFORM:
			return statement.getTransform() != null;
		default:
			return true;
		}
	}

	private static String clauseDescription(Clause clause) {
		switch (clause) {
		case COLUMN:
			return TokenType.COLUMN.getDescription();
		case COLUMNS:
			return TokenType.COLUMNS.getDescription();
		case BY:
			return TokenType.BY.getDescription();
		case ON:
			return TokenType.ON.getDescription();
		case WHERE:
			return TokenType.WHERE.getDescription();
		default:
			return TokenType.WITH.getDescription();
		}
	}

	private static Object negate(Object number) {
		if (number instanceof Long) {
			return Long.valueOf(-((Long) number).longValue());
		}
		if (number instanceof BigInteger) {
			return ((BigInteger) number).negate();
		}
		return Double.valueOf(-((Double) number).doubleValue());
	}

	/**
	 * Detects a file format from the extension of a path.
	 *
	 * @param path file path
	 * @return {@code csv}, {@code json}, {@code excel} or {@code parquet}
	 */
	static String detectFormat(String path) {
		String lower = path.toLowerCase(Locale.ROOT);
		if (lower.endsWith(".json")) {
			return "json";
		}
		if (lower.endsWith(".xlsx") || lower.endsWith(".xls")) {
			return "excel";
		}
		if (lower.endsWith(".parquet")) {
			return "parquet";
		}
		return "csv";
	}

	private String context() {
		return current == null ? "statement" : current.getKind().describe();
	}

	private static String hint(StatementContract contract) {
		if (contract != null && contract.getUsage() != null) {
			return contract.getUsage();
		}
		return "Check the syntax for " + (contract == null ? "statement" : contract.getKind().describe());
	}

	private String sourceLine(int line) {
		return line >= 1 && line <= sourceLines.length ? sourceLines[line - 1] : "";
	}

	private ParserException mismatch(String expected) {
		if (token.is(TokenType.EOF)) {
			Token last = previous == null ? token : previous;
			return new ParserException(
					Diagnostic
							.builder(ErrorCategory.SYNTAX, "Unexpected end of file in " + context() + ". Expected " + expected)
							.at(last.getLine(), last.getColumn() + last.getLength(), 1, sourceLine(last.getLine()))
							.hint("The file ended before the " + context() + " was complete")
							.build());
		}
		return parserException("Expected " + expected + ", got " + token.describe() + " in " + context(), token,
				hint(current), null);
	}

	private ParserException unknownParameter(Token nameToken, String name, StatementContract contract) {
		String hint = contract.getParameters().isEmpty() ? contract.getKind().describe() + " takes no parameters"
				: "Valid parameters for " + contract.getKind().describe() + ": " + String.join(", ", contract.getParameters());
		return parserException(
				"Unknown parameter '" + name + "' for " + contract.getKind().describe(),
				nameToken,
				hint,
				Suggestions.nearest(name, contract.getParameters()));
	}

	private ParserException parserException(String message, Token at, String hint, String suggestion) {
		return new ParserException(
				Diagnostic
						.builder(ErrorCategory.SYNTAX, message)
						.at(at.getLine(), at.getColumn(), Math.max(1, at.getLength()), sourceLine(at.getLine()))
						.hint(hint)
						.suggestion(suggestion)
						.build());
	}
}
