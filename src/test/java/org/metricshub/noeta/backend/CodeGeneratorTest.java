package org.metricshub.noeta.backend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;
import static org.metricshub.noeta.NoetaTestSupport.parse;

import java.util.ArrayList;
import java.util.Arrays;
import org.junit.Test;
import org.metricshub.noeta.frontend.ast.StatementKind;

public class CodeGeneratorTest {

	private static final String PRELUDE = "from scipy import stats\n"
			+ "import matplotlib.pyplot as plt\n"
			+ "import numpy as np\n"
			+ "import pandas as pd\n"
			+ "import seaborn as sns\n"
			+ "\n"
			+ "# Configure visualization settings\n"
			+ "plt.style.use('seaborn-v0_8-darkgrid')\n"
			+ "sns.set_palette('husl')\n"
			+ "\n";

	private static String generate(String... lines) {
		return new CodeGenerator().generate(parse(lines));
	}

	/**
	 * @return the generated statement lines, without prelude
	 */
	private static String body(String... lines) {
		String script = generate(lines);
		assertTrue(script, script.startsWith(PRELUDE));
		return script.substring(PRELUDE.length());
	}

	@Test
	public void testLoadAndDescribe() {
		assertEquals(PRELUDE
				+ "d = pd.read_csv('x.csv')\n"
				+ "print(f'Loaded x.csv as d: {len(d)} rows, {len(d.columns)} columns')\n"
				+ "print(f'\\nDescriptive Statistics for d:')\n"
				+ "print(d.describe())",
				generate("load \"x.csv\" as d", "describe d"));
	}

	@Test
	public void testEmptyProgram() {
		assertEquals(PRELUDE, generate(""));
	}

	@Test
	public void testGenerationIsRepeatable() {
		CodeGenerator generator = new CodeGenerator();
		String first = generator.generate(parse("load \"x.csv\" as d", "boxplot d"));
		assertTrue(generator.isPlotEmitted());
		assertEquals(first, generator.generate(parse("load \"x.csv\" as d", "boxplot d")));
		generator.generate(parse("load \"x.csv\" as d"));
		assertFalse(generator.isPlotEmitted());
	}

	@Test
	public void testEveryStatementKindHasTemplate() {
		CodeGenerator generator = new CodeGenerator();
		for (StatementKind kind : StatementKind.values()) {
			assertTrue(kind.toString(), generator.supports(kind));
		}
	}

	@Test
	public void testDefinedAliases() {
		CodeGenerator generator = new CodeGenerator();
		generator.generate(parse("load \"x.csv\" as d", "head d with n=2 as h", "describe h", "filter d where a > 1 as f"));
		assertEquals(Arrays.asList("d", "h", "f"), new ArrayList<String>(generator.getDefinedAliases()));
	}

	@Test
	public void testLoadFormats() {
		assertTrue(body("load \"a.json\" as a").startsWith("a = pd.read_json('a.json')\n"));
		assertTrue(body("load excel \"a.xlsx\" with sheet_name=\"Q1\" as a")
				.startsWith("a = pd.read_excel('a.xlsx', sheet_name='Q1')\n"));

		String script = generate("load sql \"select * from t\" from \"sqlite:///db.sqlite\" as q");
		assertTrue(script.contains("from sqlalchemy import create_engine\nimport matplotlib.pyplot as plt\n"));
		assertTrue(script.endsWith("_engine = create_engine('sqlite:///db.sqlite')\n"
				+ "q = pd.read_sql('select * from t', con=_engine)\n"
				+ "print(f'Loaded from SQL as q: {len(q)} rows, {len(q.columns)} columns')"));
	}

	@Test
	public void testSave() {
		assertEquals("d.to_csv('out.csv', index=False)\nprint(f'Saved d to out.csv')", body("save d to \"out.csv\""));
		assertEquals("d.to_json('out.json', orient='records', indent=2)\nprint(f'Saved d to out.json')",
				body("save d to \"out.json\""));
	}

	@Test
	public void testFilter() {
		assertEquals("f = d[(d['price'] > 10) & (d['region'] == 'N')].copy()\n"
				+ "print(f'Filtered d: {len(f)} rows match condition')",
				body("filter d where price > 10 and region == \"N\" as f"));
	}

	@Test
	public void testHeadWithAndWithoutAlias() {
		assertEquals("h = d.head(3)\nprint(f'Created alias h with first 3 rows')", body("head d with n=3 as h"));
		assertEquals("print(f'\\nFirst 5 rows of d:')\nprint(d.head(5))", body("head d"));
	}

	@Test
	public void testSelectAndSort() {
		assertEquals("s = d[['a', 'b']].copy()\nprint(f'Selected {len(s.columns)} columns from d')",
				body("select d with a, b as s"));
		assertEquals("s = d.sort_values(by=['price', 'name'], ascending=[False, True]).copy()\n"
				+ "print(f'Sorted d by price desc, name')", body("sort d by price desc, name as s"));
	}

	@Test
	public void testDerivedColumn() {
		assertEquals("c = d.copy()\n"
				+ "c['price_cumsum'] = c['price'].cumsum()\n"
				+ "print(f'Computed cumsum of price into price_cumsum')", body("cumsum d column price as c"));
		assertTrue(body("cumsum d column price").startsWith("_temp = d.copy()\n_temp['price_cumsum'] = _temp['price'].cumsum()\n"));
		assertTrue(body("cumsum d column price").endsWith("\nprint(_temp)"));
	}

	@Test
	public void testMutate() {
		assertEquals("m = d.copy()\n"
				+ "m['y'] = (1 + (2 * (3 ** 2)))\n"
				+ "m['total'] = (m['price'] * m['qty'])\n"
				+ "print(f'Added/modified 2 columns')",
				body("mutate d with y = 1 + 2 * 3 ** 2 with total = price * qty as m"));
		assertTrue(body("mutate d {t: \"a + b\"} as m").contains("m['t'] = m.eval('a + b')\n"));
	}

	@Test
	public void testGroupBy() {
		String code = body("groupby d by region compute {sum: revenue, avg: revenue, count: id} as g");
		assertTrue(code, code.startsWith(
				"g = d.groupby(['region']).agg({'revenue': ['sum', 'mean'], 'id': ['count']}).reset_index()\n"
						+ "print(f'Grouped by [region]: {len(g)} groups')\n"));
		assertTrue(code, code.endsWith("g.columns = ['_'.join(col).strip('_') if isinstance(col, tuple) else col for col in g.columns]"));

		assertEquals("g = d.groupby(['a', 'b']).size().reset_index(name='count')\n"
				+ "print(f'Grouped by [a, b]: {len(g)} groups')", body("groupby d by a, b as g"));
	}

	@Test
	public void testJoin() {
		assertEquals("j = pd.merge(a, b, on='id', how='inner')\nprint(f'Joined a and b: {len(j)} rows')",
				body("join a with b on id as j"));
		assertTrue(body("join a with b on id with how=\"left\" as j").startsWith("j = pd.merge(a, b, on='id', how='left')"));
	}

	@Test
	public void testPlotTrailer() {
		String script = generate("load \"x.csv\" as d", "boxplot d with price by region");
		assertTrue(script.contains("plt.figure(figsize=(10, 6))\nd.boxplot(column='price', by='region')\n"));
		assertTrue(script.endsWith("\n\n# Display plots\n"
				+ "plt.tight_layout()\n"
				+ "try:\n"
				+ "    get_ipython()\n"
				+ "    # interactive kernel: figures are displayed inline\n"
				+ "except NameError:\n"
				+ "    plt.show()"));
		assertFalse(generate("load \"x.csv\" as d", "describe d").contains("# Display plots"));
	}

	@Test
	public void testStringsAreEscaped() {
		String code = body("load \"it's {here}.csv\" as d");
		assertTrue(code, code.startsWith("d = pd.read_csv('it\\'s {here}.csv')\n"
				+ "print(f'Loaded it\\'s {{here}}.csv as d: "));
	}

	@Test
	public void testLargeIntegerLiteral() {
		String script = body("head d with n=99999999999999999999999 as h");
		assertTrue(script, script.startsWith("h = d.head(99999999999999999999999)\n"));
	}

	@Test
	public void testFillMethods() {
		assertTrue(body("fillna d column price with method=\"FFILL\"").contains(".ffill()"));
		IllegalStateException e = assertThrows(IllegalStateException.class,
				() -> generate("fillna d column price with method=\"meen\""));
		assertEquals("Unknown fill method meen", e.getMessage());
	}
}
