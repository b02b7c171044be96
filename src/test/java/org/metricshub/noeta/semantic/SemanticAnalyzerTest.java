package org.metricshub.noeta.semantic;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.Before;
import org.junit.Test;
import org.metricshub.noeta.NoetaTestSupport;
import org.metricshub.noeta.diagnostics.Diagnostic;
import org.metricshub.noeta.diagnostics.ErrorCategory;
import org.metricshub.noeta.util.NoetaSettings;

public class SemanticAnalyzerTest {

	private static final Map<String, DataType> SALES = new LinkedHashMap<String, DataType>();

	static {
		SALES.put("price", DataType.NUMERIC);
		SALES.put("region", DataType.STRING);
		SALES.put("qty", DataType.NUMERIC);
		SALES.put("sold_on", DataType.DATETIME);
	}

	private NoetaSettings settings;
	private SymbolTable table;

	@Before
	public void setUp() {
		settings = new NoetaSettings();
		table = new SymbolTable();
	}

	private List<Diagnostic> analyze(String... lines) {
		String code = String.join("\n", lines);
		return new SemanticAnalyzer(settings, code).analyze(NoetaTestSupport.parse(lines), table);
	}

	private void typeCheckWith(SchemaProbe columns) {
		settings.setTypeCheck(true);
		settings.setSchemaProbe(columns);
	}

	private void typeCheckSales() {
		typeCheckWith((path, format) -> SALES);
	}

	// datasets
	// ===============================================================================

	@Test
	public void testValidProgram() {
		assertTrue(analyze("load \"x.csv\" as d", "describe d").isEmpty());
		assertTrue(table.exists("d"));
		assertEquals("file:x.csv", table.lookup("d").getProvenance());
		assertFalse(table.lookup("d").isSchemaKnown());
	}

	@Test
	public void testUndefinedDataset() {
		List<Diagnostic> diagnostics = analyze("select unknown with price as r");
		assertEquals(1, diagnostics.size());
		Diagnostic d = diagnostics.get(0);
		assertEquals(ErrorCategory.SEMANTIC, d.getCategory());
		assertEquals("Dataset 'unknown' has not been loaded or created", d.getMessage());
		assertEquals("No datasets have been loaded yet", d.getHint());
		assertNull(d.getSuggestion());
		assertEquals(8, d.getContext().getColumn());
		assertEquals(7, d.getContext().getLength());
		assertFalse(table.exists("r"));
	}

	@Test
	public void testUndefinedDatasetSuggestion() {
		List<Diagnostic> diagnostics = analyze("load \"x.csv\" as sales", "select sale with price as r");
		assertEquals(1, diagnostics.size());
		assertEquals("sales", diagnostics.get(0).getSuggestion());
		assertEquals("Available datasets: sales", diagnostics.get(0).getHint());
		assertEquals(2, diagnostics.get(0).getContext().getLine());
		assertEquals("select sale with price as r", diagnostics.get(0).getContext().getSourceLine());
	}

	@Test
	public void testAllDiagnosticsAreCollected() {
		List<Diagnostic> diagnostics = analyze("select a with x as b", "load \"x.csv\" as d", "join d with e on id as j",
				"describe f");
		assertEquals(3, diagnostics.size());
		assertEquals("Dataset 'a' has not been loaded or created", diagnostics.get(0).getMessage());
		assertEquals("Dataset 'e' has not been loaded or created", diagnostics.get(1).getMessage());
		assertEquals("Dataset 'f' has not been loaded or created", diagnostics.get(2).getMessage());
	}

	@Test
	public void testFailedStatementDefinesNothing() {
		List<Diagnostic> diagnostics = analyze("head missing with n=3 as top", "describe top");
		assertEquals(2, diagnostics.size());
		assertEquals("Dataset 'top' has not been loaded or created", diagnostics.get(1).getMessage());
	}

	@Test
	public void testSymbolTableCarriesAcrossAnalyses() {
		assertTrue(analyze("load \"x.csv\" as d").isEmpty());
		assertTrue(analyze("head d with n=5 as h").isEmpty());
		assertEquals("head(d)", table.lookup("h").getProvenance());
		assertEquals(Arrays.asList("d", "h"), table.getAllNames());
	}

	@Test
	public void testSqlLoad() {
		typeCheckWith((path, format) -> {
			throw new AssertionError("SQL sources are not probed");
		});
		assertTrue(analyze("load sql \"select 1\" from \"sqlite:///x.db\" as q", "select q with anything as r").isEmpty());
		assertEquals(SemanticAnalyzer.SQL_PROVENANCE, table.lookup("q").getProvenance());
	}

	// columns
	// ===============================================================================

	@Test
	public void testColumnsUncheckedWithoutTypeChecking() {
		settings.setSchemaProbe((path, format) -> {
			throw new AssertionError("no file reads without type checking");
		});
		assertTrue(analyze("load \"x.csv\" as d", "select d with whatever as r", "round d column nope").isEmpty());
	}

	@Test
	public void testUnknownColumn() {
		typeCheckSales();
		List<Diagnostic> diagnostics = analyze("load \"x.csv\" as sales", "select sales with prise, qty as r");
		assertEquals(1, diagnostics.size());
		Diagnostic d = diagnostics.get(0);
		assertEquals(ErrorCategory.SEMANTIC, d.getCategory());
		assertEquals("Column 'prise' does not exist in dataset 'sales'", d.getMessage());
		assertEquals("Available columns in 'sales': price, region, qty, sold_on", d.getHint());
		assertEquals("price", d.getSuggestion());
		assertEquals(19, d.getContext().getColumn());
	}

	@Test
	public void testColumnsInEveryClause() {
		typeCheckSales();
		List<Diagnostic> diagnostics = analyze("load \"x.csv\" as s",
				"filter s where price > 1 and colour == \"red\" as f",
				"sort s by qty desc, weight as o",
				"groupby s by region compute {sum: revenue} as g",
				"drop_duplicates s with subset=[\"region\", \"zone\"] as u");
		assertEquals(4, diagnostics.size());
		assertTrue(diagnostics.get(0).getMessage().startsWith("Column 'colour'"));
		assertTrue(diagnostics.get(1).getMessage().startsWith("Column 'weight'"));
		assertTrue(diagnostics.get(2).getMessage().startsWith("Column 'revenue'"));
		assertTrue(diagnostics.get(3).getMessage().startsWith("Column 'zone'"));
	}

	@Test
	public void testProjection() {
		typeCheckSales();
		List<Diagnostic> diagnostics = analyze("load \"x.csv\" as s", "select s with region, price as r",
				"select r with qty as q");
		assertEquals(1, diagnostics.size());
		assertEquals("Column 'qty' does not exist in dataset 'r'", diagnostics.get(0).getMessage());
		assertEquals(Arrays.asList("region", "price"), table.lookup("r").getColumnNames());
		assertEquals("select(s)", table.lookup("r").getProvenance());
	}

	@Test
	public void testDerivedColumns() {
		typeCheckSales();
		assertTrue(analyze("load \"x.csv\" as s", "cumsum s column price as c", "duplicated s as dup",
				"extract s column sold_on with part=\"month\" as m").isEmpty());
		DatasetInfo c = table.lookup("c");
		assertEquals(Arrays.asList("price", "region", "qty", "sold_on", "price_cumsum"), c.getColumnNames());
		assertEquals(DataType.NUMERIC, c.getType("price_cumsum"));
		assertEquals(DataType.BOOLEAN, table.lookup("dup").getType("is_duplicate"));
		assertTrue(table.lookup("m").hasColumn("sold_on_month"));
	}

	@Test
	public void testRetypedColumns() {
		typeCheckSales();
		assertTrue(analyze("load \"x.csv\" as s", "astype s column price with dtype=\"object\" as t",
				"label_encode s column region as e").isEmpty());
		assertEquals(DataType.STRING, table.lookup("t").getType("price"));
		assertEquals(DataType.NUMERIC, table.lookup("e").getType("region"));
	}

	@Test
	public void testAssignAndMutate() {
		typeCheckSales();
		assertTrue(analyze("load \"x.csv\" as s", "assign s column flag with value=true as a",
				"mutate a with total = price * qty as m").isEmpty());
		assertEquals(DataType.BOOLEAN, table.lookup("a").getType("flag"));
		assertTrue(table.lookup("m").hasColumn("total"));
		assertTrue(table.lookup("m").hasColumn("flag"));
	}

	@Test
	public void testRename() {
		typeCheckSales();
		List<Diagnostic> diagnostics = analyze("load \"x.csv\" as s", "rename s with mapping={\"price\": \"cost\"} as r",
				"rename s with mapping={\"cost\": \"x\"} as bad");
		assertEquals(1, diagnostics.size());
		assertEquals("Column 'cost' does not exist in dataset 's'", diagnostics.get(0).getMessage());
		assertEquals(Arrays.asList("cost", "region", "qty", "sold_on"), table.lookup("r").getColumnNames());
		assertFalse(table.exists("bad"));
	}

	@Test
	public void testReshapingLosesSchema() {
		typeCheckSales();
		assertTrue(analyze("load \"x.csv\" as s", "groupby s by region compute {sum: price} as g",
				"select g with price_sum, anything as r").isEmpty());
		assertFalse(table.lookup("g").isSchemaKnown());
		assertFalse(table.lookup("r").isSchemaKnown());
	}

	@Test
	public void testEmptyColumnListIsUnknownSchema() {
		typeCheckWith((path, format) -> Collections.<String, DataType>emptyMap());
		assertTrue(analyze("load \"x.csv\" as s", "select s with anything as r").isEmpty());
		assertFalse(table.lookup("s").isSchemaKnown());
	}

	@Test
	public void testJoinKeysOnBothSides() {
		typeCheckWith((path, format) -> {
			Map<String, DataType> schema = new LinkedHashMap<String, DataType>();
			schema.put("name", DataType.STRING);
			if (path.startsWith("orders")) {
				schema.put("customer_id", DataType.NUMERIC);
			} else {
				schema.put("id", DataType.NUMERIC);
			}
			return schema;
		});
		List<Diagnostic> diagnostics = analyze("load \"orders.csv\" as o", "load \"customers.csv\" as c",
				"join o with c on customer_id as j", "merge o with c with left_on=customer_id, right_on=id as m");
		assertEquals(1, diagnostics.size());
		assertEquals("Column 'customer_id' does not exist in dataset 'c'", diagnostics.get(0).getMessage());
		assertTrue(table.exists("m"));
	}

	@Test
	public void testHypothesisColumnsInBothDatasets() {
		typeCheckWith((path, format) -> path.startsWith("a") ? SALES
				: Collections.singletonMap("price", DataType.NUMERIC));
		List<Diagnostic> diagnostics = analyze("load \"a.csv\" as a", "load \"b.csv\" as b",
				"hypothesis a vs b columns [price, qty]");
		assertEquals(1, diagnostics.size());
		assertEquals("Column 'qty' does not exist in dataset 'b'", diagnostics.get(0).getMessage());
	}

	// types
	// ===============================================================================

	@Test
	public void testTypeMismatch() {
		typeCheckSales();
		List<Diagnostic> diagnostics = analyze("load \"x.csv\" as s", "upper s column price as u",
				"extract_year s column region as y", "round s column price with decimals=1 as ok");
		assertEquals(2, diagnostics.size());
		Diagnostic d = diagnostics.get(0);
		assertEquals(ErrorCategory.TYPE, d.getCategory());
		assertEquals("Column 'price' has type numeric, expected string", d.getMessage());
		assertEquals("This operation requires a string column", d.getHint());
		assertEquals("Column 'region' has type string, expected datetime", diagnostics.get(1).getMessage());
		assertFalse(table.exists("u"));
		assertTrue(table.exists("ok"));
	}

	@Test
	public void testUnknownTypesAreNotChecked() {
		typeCheckWith((path, format) -> Collections.singletonMap("note", DataType.UNKNOWN));
		assertTrue(analyze("load \"x.csv\" as s", "round s column note as r").isEmpty());
		assertEquals(DataType.NUMERIC, table.lookup("r").getType("note"));
	}

	@Test
	public void testLoadKeepsColumnNullability() {
		typeCheckWith(new SchemaProbe() {
			@Override
			public Map<String, DataType> probe(String path, String format) {
				throw new AssertionError("columns are read with their nullability");
			}

			@Override
			public List<ColumnInfo> probeColumns(String path, String format) {
				return Arrays.asList(new ColumnInfo("id", DataType.NUMERIC, false), new ColumnInfo("note", DataType.STRING));
			}
		});
		assertTrue(analyze("load parquet \"x.parquet\" as s").isEmpty());
		assertFalse(table.lookup("s").getColumn("id").isNullable());
		assertTrue(table.lookup("s").getColumn("note").isNullable());
	}

	// parameters
	// ===============================================================================

	@Test
	public void testUnknownFillMethod() {
		List<Diagnostic> diagnostics = analyze("load \"x.csv\" as s", "fillna s column price with method=\"meen\" as f");
		assertEquals(1, diagnostics.size());
		Diagnostic d = diagnostics.get(0);
		assertEquals(ErrorCategory.SEMANTIC, d.getCategory());
		assertEquals("Unknown fill method 'meen' in fillna statement", d.getMessage());
		assertEquals("Accepted methods: mean, median, mode, forward, ffill, backward, bfill", d.getHint());
		assertEquals("mean", d.getSuggestion());
		assertEquals(2, d.getContext().getLine());
		assertEquals(35, d.getContext().getColumn());
		assertFalse(table.exists("f"));
	}

	@Test
	public void testKnownFillMethods() {
		assertTrue(analyze("load \"x.csv\" as s", "fillna s column price with method=\"median\" as a",
				"fillna s with method=FFILL as b", "fillna s with value=0 as c").isEmpty());
		assertTrue(table.exists("a"));
		assertTrue(table.exists("b"));
		assertTrue(table.exists("c"));
	}
}
