package org.metricshub.noeta.backend;

import static org.junit.Assert.assertEquals;
import static org.metricshub.noeta.NoetaTestSupport.statement;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.Test;
import org.metricshub.noeta.frontend.ast.Condition;
import org.metricshub.noeta.frontend.ast.Expression;

public class PythonWriterTest {

	private static Condition where(String condition) {
		return statement("filter d where " + condition + " as f").getWhere();
	}

	private static Expression expr(String expression) {
		return statement("mutate d with y = " + expression).getMutations().get(0).getExpression();
	}

	@Test
	public void testValues() {
		assertEquals("None", PythonWriter.value(null));
		assertEquals("True", PythonWriter.value(Boolean.TRUE));
		assertEquals("False", PythonWriter.value(Boolean.FALSE));
		assertEquals("-3", PythonWriter.value(Long.valueOf(-3)));
		assertEquals("2.5", PythonWriter.value(Double.valueOf(2.5)));
		assertEquals("float('nan')", PythonWriter.value(Double.valueOf(Double.NaN)));
		assertEquals("float('-inf')", PythonWriter.value(Double.valueOf(Double.NEGATIVE_INFINITY)));
		assertEquals("'it\\'s'", PythonWriter.value("it's"));
		assertEquals("[1, 'a', None]", PythonWriter.value(Arrays.<Object>asList(Long.valueOf(1), "a", null)));

		Map<String, Object> map = new LinkedHashMap<String, Object>();
		map.put("old", "new");
		map.put("n", Collections.singletonList(Boolean.TRUE));
		assertEquals("{'old': 'new', 'n': [True]}", PythonWriter.value(map));
	}

	@Test
	public void testQuoteAndText() {
		assertEquals("'C:\\\\data\\\\x.csv'", PythonWriter.quote("C:\\data\\x.csv"));
		assertEquals("'a\\nb'", PythonWriter.quote("a\nb"));
		assertEquals("Saved {{x}} to it\\'s", PythonWriter.text("Saved {x} to it's"));
	}

	@Test
	public void testColumns() {
		assertEquals("d['unit price']", PythonWriter.column("d", "unit price"));
		assertEquals("['a', 'b']", PythonWriter.strings(Arrays.asList("a", "b")));
		assertEquals("[]", PythonWriter.strings(Collections.<String>emptyList()));
		assertEquals("'a'", PythonWriter.nameOrNames(statement("select d with a").getColumns()));
		assertEquals("['a', 'b']", PythonWriter.nameOrNames(statement("select d with a, b").getColumns()));
	}

	@Test
	public void testComparisons() {
		assertEquals("(d['price'] > 10) & (d['region'] == 'N')",
				PythonWriter.condition(where("price > 10 and region = \"N\""), "d"));
		assertEquals("d['qty'] != None", PythonWriter.condition(where("qty != none"), "d"));
	}

	@Test
	public void testConditionForms() {
		assertEquals("(~(d['price'].between(1, 5))) | (d['name'].str.contains('x', regex=False, na=False))",
				PythonWriter.condition(where("not price between 1 and 5 or name contains \"x\""), "d"));
		assertEquals("d['r'].isin(['A', 'B'])", PythonWriter.condition(where("r in [\"A\", \"B\"]"), "d"));
		assertEquals("d['r'].isnull()", PythonWriter.condition(where("r is null"), "d"));
		assertEquals("d['r'].notnull()", PythonWriter.condition(where("r is not null"), "d"));
		assertEquals("d['r'].str.startswith('a', na=False)", PythonWriter.condition(where("r starts_with \"a\""), "d"));
		assertEquals("d['r'].str.endswith('z', na=False)", PythonWriter.condition(where("r ends_with \"z\""), "d"));
		assertEquals("d['r'].str.contains('^a.*', regex=True, na=False)",
				PythonWriter.condition(where("r matches \"^a.*\""), "d"));
	}

	@Test
	public void testArithmetic() {
		assertEquals("(1 + (2 * (3 ** 2)))", PythonWriter.expression(expr("1 + 2 * 3 ** 2"), "d", null));
		assertEquals("((d['price'] * d['qty']) - 1.5)", PythonWriter.expression(expr("price * qty - 1.5"), "d", null));
		assertEquals("(-d['price'])", PythonWriter.expression(expr("-price"), "d", null));
		assertEquals("(d['a'] % 2)", PythonWriter.expression(expr("a % 2"), "d", null));
	}

	@Test
	public void testLogicalOperators() {
		assertEquals("((d['a'] > 1) & (~d['flag']))", PythonWriter.expression(expr("a > 1 and not flag"), "d", null));
		assertEquals("((d['a'] == 1) | (d['b'] == 2))", PythonWriter.expression(expr("a == 1 or b == 2"), "d", null));
	}

	@Test
	public void testConditional() {
		assertEquals("np.where((d['price'] > 100), 'high', 'low')",
				PythonWriter.expression(expr("\"high\" where price > 100 else \"low\""), "d", null));
	}

	@Test
	public void testCalls() {
		assertEquals("np.round(d['price'], 2)", PythonWriter.expression(expr("round(price, 2)"), "d", null));
		assertEquals("np.maximum(d['a'], 0)", PythonWriter.expression(expr("max(a, 0)"), "d", null));
		assertEquals("d['name'].str.upper()", PythonWriter.expression(expr("upper(name)"), "d", null));
		assertEquals("d['sold_on'].dt.year", PythonWriter.expression(expr("year(sold_on)"), "d", null));
		assertEquals("pd.isna(d['a'])", PythonWriter.expression(expr("isnull(a)"), "d", null));
		assertEquals("custom(d['a'])", PythonWriter.expression(expr("custom(a)"), "d", null));
	}

	@Test
	public void testCurrentValue() {
		assertEquals("(_c * 2)", PythonWriter.expression(expr("value * 2"), "d", "_c"));
		assertEquals("(_c ** 2)", PythonWriter.expression(expr("x ** 2"), "d", "_c"));
		assertEquals("(d['value'] * 2)", PythonWriter.expression(expr("value * 2"), "d", null));
	}
}
