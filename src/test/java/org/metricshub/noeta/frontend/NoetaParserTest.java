package org.metricshub.noeta.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;
import static org.metricshub.noeta.NoetaTestSupport.parse;
import static org.metricshub.noeta.NoetaTestSupport.statement;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Map;
import org.junit.Test;
import org.metricshub.noeta.diagnostics.Diagnostic;
import org.metricshub.noeta.diagnostics.ErrorCategory;
import org.metricshub.noeta.frontend.ast.Condition;
import org.metricshub.noeta.frontend.ast.Expression;
import org.metricshub.noeta.frontend.ast.Program;
import org.metricshub.noeta.frontend.ast.SourcePosition;
import org.metricshub.noeta.frontend.ast.Statement;
import org.metricshub.noeta.frontend.ast.StatementKind;

public class NoetaParserTest {

	private static Diagnostic syntaxError(String... lines) {
		ParserException e = assertThrows(ParserException.class, () -> parse(lines));
		assertEquals(ErrorCategory.SYNTAX, e.getCategory());
		assertEquals(1, e.getDiagnostics().size());
		return e.getDiagnostic();
	}

	// load
	// ===============================================================================

	@Test
	public void testLoad() {
		Statement load = statement("load \"data.csv\" as sales");
		assertEquals(StatementKind.LOAD, load.getKind());
		assertEquals("data.csv", load.getPath());
		assertEquals("csv", load.getFormat());
		assertEquals("sales", load.getResultAlias().getName());
		assertTrue(load.getSources().isEmpty());
	}

	@Test
	public void testLoadFormatDetection() {
		assertEquals("json", statement("load \"a.JSON\" as a").getFormat());
		assertEquals("excel", statement("load \"a.xlsx\" as a").getFormat());
		assertEquals("parquet", statement("load \"a.parquet\" as a").getFormat());
		assertEquals("json", statement("load json \"a.txt\" as a").getFormat());
		assertEquals("csv", statement("load \"a.txt\" as a").getFormat());
	}

	@Test
	public void testLoadSql() {
		Statement load = statement("load sql \"select * from t\" from \"sqlite:///db.sqlite\" as q");
		assertEquals("sql", load.getFormat());
		assertEquals("select * from t", load.getPath());
		assertEquals("sqlite:///db.sqlite", load.getConnection());
		assertEquals("q", load.getResultAlias().getName());
	}

	@Test
	public void testLoadRequiresAlias() {
		Diagnostic d = syntaxError("load \"data.csv\"");
		assertEquals("Unexpected end of file in load statement. Expected \"as\" keyword", d.getMessage());
	}

	@Test
	public void testSaveFormatParameter() {
		Statement save = statement("save d to \"out.data\" with format=json");
		assertEquals("json", save.getFormat());
		assertEquals("out.data", save.getPath());
		assertEquals("d", save.getSource().getName());
	}

	// statement structure
	// ===============================================================================

	@Test
	public void testStatementPositions() {
		Program program = parse("load \"x.csv\" as d", "  select d with a, b as e");
		assertEquals(2, program.size());
		assertEquals(new SourcePosition(1, 1), program.getStatements().get(0).getPosition());
		Statement select = program.getStatements().get(1);
		assertEquals(new SourcePosition(2, 3), select.getPosition());
		assertEquals("2:3", select.getPosition().toString());
		assertEquals(2, select.getColumns().size());
		assertEquals("a", select.getColumns().get(0).getName());
		assertEquals(new SourcePosition(2, 17), select.getColumns().get(0).getPosition());
	}

	@Test
	public void testSelectBraceList() {
		Statement select = statement("select d {\"unit price\", qty} as e");
		assertEquals("unit price", select.getColumns().get(0).getName());
		assertEquals("qty", select.getColumns().get(1).getName());
	}

	@Test
	public void testStatementsWithoutNewlines() {
		Program program = parse("load \"x.csv\" as d describe d info d");
		assertEquals(3, program.size());
		assertEquals(StatementKind.INFO, program.getStatements().get(2).getKind());
	}

	@Test
	public void testEmptyProgram() {
		assertTrue(parse("", "# nothing here", "").isEmpty());
	}

	@Test
	public void testSort() {
		Statement sort = statement("sort d by price desc, name as s");
		assertEquals(2, sort.getSortKeys().size());
		assertTrue(sort.getSortKeys().get(0).isDescending());
		assertFalse(sort.getSortKeys().get(1).isDescending());
		assertEquals("name", sort.getSortKeys().get(1).getColumn().getName());
	}

	@Test
	public void testGroupByCompute() {
		Statement groupBy = statement("groupby sales by region, year compute {sum: revenue, avg: price} as g");
		assertEquals(2, groupBy.getGroupBy().size());
		assertEquals("year", groupBy.getGroupBy().get(1).getName());
		assertEquals(2, groupBy.getAggregations().size());
		assertEquals("sum", groupBy.getAggregations().get(0).getFunction());
		assertEquals("revenue", groupBy.getAggregations().get(0).getColumn().getName());
		assertEquals("avg: price", groupBy.getAggregations().get(1).toString());
	}

	@Test
	public void testJoin() {
		Statement join = statement("join orders with customers on customer_id as j");
		assertEquals(2, join.getSources().size());
		assertEquals("customers", join.getSources().get(1).getName());
		assertEquals("customer_id", join.getGroupBy().get(0).getName());
	}

	@Test
	public void testMultiSource() {
		Statement concat = statement("concat_vertical [a, b, c] as all_rows");
		assertEquals(3, concat.getSources().size());
		Diagnostic d = syntaxError("concat_vertical [] as x");
		assertEquals("At least one dataset is required in concat_vertical statement", d.getMessage());
	}

	@Test
	public void testHypothesis() {
		Statement test = statement("hypothesis a vs: b columns [score] with test=welch");
		assertEquals(2, test.getSources().size());
		assertEquals("score", test.getColumns().get(0).getName());
		assertEquals("welch", test.getValue("test"));
	}

	// parameters
	// ===============================================================================

	@Test
	public void testParameterValues() {
		assertEquals(Long.valueOf(-3), statement("shift d column price with periods=-3 as s").getValue("periods"));
		assertEquals(Double.valueOf(0.5), statement("quantile d column price with q=0.5").getValue("q"));

		Statement fill = statement("fillna d column price with value=none as f");
		assertTrue(fill.hasParameter("value"));
		assertNull(fill.getValue("value"));

		Statement isin = statement("filter_isin d column region with values=[\"N\", \"S\"] as f");
		assertEquals(Arrays.asList("N", "S"), isin.getValue("values"));
	}

	@Test
	public void testMappingParameter() {
		Statement rename = statement("rename d with mapping={\"old\": \"new\", qty: \"quantity\"} as r");
		Map<?, ?> mapping = (Map<?, ?>) rename.getValue("mapping");
		assertEquals("new", mapping.get("old"));
		assertEquals("quantity", mapping.get("qty"));
		assertEquals(Arrays.asList("old", "qty"), Arrays.asList(mapping.keySet().toArray()));
	}

	@Test
	public void testFlags() {
		Statement sample = statement("sample d with n=10 random as s");
		assertEquals(Long.valueOf(10), sample.getValue("n"));
		assertEquals(Boolean.TRUE, sample.getValue("random"));
		assertFalse(statement("sample d with n=10 as s").isSet("random"));
	}

	@Test
	public void testUnknownParameter() {
		Diagnostic d = syntaxError("head d with m=5");
		assertEquals("Unknown parameter 'm' for head statement", d.getMessage());
		assertEquals("Valid parameters for head statement: n", d.getHint());
		assertEquals("n", d.getSuggestion());
		assertEquals(13, d.getContext().getColumn());
	}

	@Test
	public void testMissingRequiredParameter() {
		Diagnostic d = syntaxError("sample d as s");
		assertEquals("Missing required parameter 'n' in sample statement", d.getMessage());
	}

	@Test
	public void testMissingRequiredClause() {
		Diagnostic d = syntaxError("filter d as f");
		assertEquals("Expected \"where\" keyword, got \"as\" keyword in filter statement", d.getMessage());
		assertTrue(d.getHint().startsWith("Use \"filter"));
	}

	@Test
	public void testDisplayStatementCannotBeBound() {
		Diagnostic d = syntaxError("describe d as x");
		assertEquals("describe statement does not produce a dataset and cannot be bound with 'as'", d.getMessage());
		assertEquals(12, d.getContext().getColumn());
	}

	// conditions and expressions
	// ===============================================================================

	@Test
	public void testConditionPrecedence() {
		Condition where = statement("filter d where a > 1 and b < 2 or c == 3 as f").getWhere();
		assertEquals(Condition.Kind.OR, where.getKind());
		assertEquals("((a > 1 AND b < 2) OR c == 3)", where.toString());
	}

	@Test
	public void testBetweenAndIn() {
		Statement filter = statement("filter d where price between 10 and 100 and category in [\"A\",\"B\"] as f");
		assertEquals("f", filter.getResultAlias().getName());
		Condition where = filter.getWhere();
		assertEquals(Condition.Kind.AND, where.getKind());

		Condition between = where.getChild(0);
		assertEquals(Condition.Kind.BETWEEN, between.getKind());
		assertEquals(Arrays.<Object>asList(Long.valueOf(10), Long.valueOf(100)), between.getValues());

		Condition in = where.getChild(1);
		assertEquals(Condition.Kind.IN, in.getKind());
		assertEquals("category", in.getColumn().getName());
		assertEquals(Arrays.<Object>asList("A", "B"), in.getValues());
	}

	@Test
	public void testInListValues() {
		Condition in = statement("filter d where code in [-99999999999999999999999, none, [1, 2]] as f").getWhere();
		assertEquals(Condition.Kind.IN, in.getKind());
		assertEquals(Arrays.<Object>asList(new BigInteger("-99999999999999999999999"), null,
				Arrays.<Object>asList(Long.valueOf(1), Long.valueOf(2))), in.getValues());
		assertThrows(UnsupportedOperationException.class, () -> in.getValues().add("x"));
		syntaxError("filter d where code in [1, 2 as f");
	}

	@Test
	public void testLargeIntegerParameter() {
		assertEquals(new BigInteger("99999999999999999999999"),
				statement("head d with n=99999999999999999999999").getParameter("n").getValue());
		assertEquals(Long.valueOf(-5), statement("head d with n=-5").getParameter("n").getValue());
	}

	@Test
	public void testConditionForms() {
		assertEquals("a == 1", statement("filter d where a = 1 as f").getWhere().toString());
		assertEquals("NOT a IS NULL", statement("filter d where not a is null as f").getWhere().toString());
		assertEquals("a IS NOT NULL", statement("filter d where a is not null as f").getWhere().toString());
		assertEquals("(a contains \"x\" OR b starts_with \"y\")",
				statement("filter d where (a contains \"x\" or b starts_with \"y\") as f").getWhere().toString());
	}

	@Test
	public void testExpressionPrecedence() {
		Statement mutate = statement("mutate d with y = 1 + 2 * 3 ** 2 as m");
		assertEquals(1, mutate.getMutations().size());
		assertEquals("y", mutate.getMutations().get(0).getColumn().getName());
		assertEquals("(1 + (2 * (3 ** 2)))", mutate.getMutations().get(0).getExpression().toString());
	}

	@Test
	public void testPowerIsRightAssociative() {
		Expression e = statement("mutate d with y = 2 ** 3 ** 2").getMutations().get(0).getExpression();
		assertEquals("(2 ** (3 ** 2))", e.toString());
	}

	@Test
	public void testUnaryAndCalls() {
		Statement mutate = statement("mutate d with y = -price * 2 with z = round(price, 2) as m");
		assertEquals(2, mutate.getMutations().size());
		assertEquals("((-price) * 2)", mutate.getMutations().get(0).getExpression().toString());
		Expression call = mutate.getMutations().get(1).getExpression();
		assertEquals(Expression.Kind.CALL, call.getKind());
		assertEquals("round", call.getName());
		assertEquals("round(price, 2)", call.toString());
	}

	@Test
	public void testConditionalExpression() {
		Expression e = statement("mutate d with tier = \"high\" where price > 100 else \"low\" as m").getMutations().get(0)
				.getExpression();
		assertEquals(Expression.Kind.CONDITIONAL, e.getKind());
		assertEquals("(\"high\" where (price > 100) else \"low\")", e.toString());
	}

	@Test
	public void testMutateTextForm() {
		Statement mutate = statement("mutate d {total: \"price * qty\"} as m");
		assertNull(mutate.getMutations().get(0).getExpression());
		assertEquals("price * qty", mutate.getMutations().get(0).getText());
	}

	// syntax errors
	// ===============================================================================

	@Test
	public void testExpectedKeyword() {
		Diagnostic d = syntaxError("select sales 123 as result");
		assertEquals("Expected \"with\" keyword, got number 123 in select statement", d.getMessage());
		assertEquals(1, d.getContext().getLine());
		assertEquals(14, d.getContext().getColumn());
		assertEquals(3, d.getContext().getLength());
	}

	@Test
	public void testUnexpectedEndOfFile() {
		Diagnostic d = syntaxError("select sales with");
		assertEquals("Unexpected end of file in select statement. Expected dataset or column name", d.getMessage());
		assertEquals(18, d.getContext().getColumn());
	}

	@Test
	public void testUnknownStatement() {
		Diagnostic d = syntaxError("selct d with a");
		assertEquals("Unexpected dataset or column name 'selct' at start of statement", d.getMessage());
		assertEquals("select", d.getSuggestion());
	}

	@Test
	public void testStatementCannotStartWithLiteral() {
		Diagnostic d = syntaxError("load \"x.csv\" as d", "42");
		assertEquals("Unexpected number 42 at start of statement", d.getMessage());
		assertEquals(2, d.getContext().getLine());
		assertNull(d.getSuggestion());
	}

	@Test
	public void testFirstErrorAborts() {
		ParserException e = assertThrows(ParserException.class, () -> parse("selct d", "describ d"));
		assertEquals(1, e.getDiagnostics().size());
		assertEquals(1, e.getDiagnostic().getContext().getLine());
	}

	@Test
	public void testDetectFormat() {
		assertEquals("excel", NoetaParser.detectFormat("report.XLS"));
		assertEquals("csv", NoetaParser.detectFormat("noext"));
	}
}
