package org.metricshub.noeta.semantic;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.Test;

public class SymbolTableTest {

	@Test
	public void testDefineAndLookup() {
		SymbolTable table = new SymbolTable();
		DatasetInfo sales = DatasetInfo.unknown("sales", "file:sales.csv");
		table.define("sales", sales);
		assertSame(sales, table.lookup("sales"));
		assertTrue(table.exists("sales"));
		assertFalse(table.exists("Sales"));
		assertNull(table.lookup("other"));
		assertEquals(1, table.size());
	}

	@Test
	public void testRedefinitionKeepsHistory() {
		SymbolTable table = new SymbolTable();
		table.define("a", DatasetInfo.unknown("a", "file:a.csv"));
		table.define("b", DatasetInfo.unknown("b", "file:b.csv"));
		DatasetInfo again = DatasetInfo.unknown("a", "head(b)");
		table.define("a", again);

		assertEquals(Arrays.asList("a", "b"), table.getAllNames());
		assertEquals(Arrays.asList("a", "b", "a"), table.getHistory());
		assertSame(again, table.lookup("a"));
		assertEquals(2, table.size());
	}

	@Test
	public void testClear() {
		SymbolTable table = new SymbolTable();
		table.define("a", DatasetInfo.unknown("a", "file:a.csv"));
		table.clear();
		assertEquals(0, table.size());
		assertTrue(table.getHistory().isEmpty());
		assertFalse(table.exists("a"));
	}

	@Test
	public void testReconcile() {
		SymbolTable table = new SymbolTable();
		DatasetInfo known = DatasetInfo.unknown("sales", "file:sales.csv");
		table.define("sales", known);

		Map<String, String> dtypes = new LinkedHashMap<String, String>();
		dtypes.put("id", "int64");
		dtypes.put("name", "object");
		dtypes.put("when", "datetime64[ns]");
		TabularValue frame = () -> dtypes;

		Map<String, Object> bindings = new HashMap<String, Object>();
		bindings.put("people", frame);
		bindings.put("sales", frame);
		bindings.put("counter", Integer.valueOf(3));

		assertEquals(Collections.singletonList("people"), table.reconcile(bindings));
		assertSame(known, table.lookup("sales"));
		assertFalse(table.exists("counter"));

		DatasetInfo people = table.lookup("people");
		assertEquals("runtime:people", people.getProvenance());
		assertEquals(Arrays.asList("id", "name", "when"), people.getColumnNames());
		assertEquals(DataType.NUMERIC, people.getType("id"));
		assertEquals(DataType.STRING, people.getType("name"));
		assertEquals(DataType.DATETIME, people.getType("when"));
	}

	@Test
	public void testDatasetInfo() {
		DatasetInfo d = new DatasetInfo("d",
				Arrays.asList(new ColumnInfo("a", DataType.NUMERIC), new ColumnInfo("b", DataType.STRING)), "file:d.csv");
		assertTrue(d.isSchemaKnown());
		assertFalse(DatasetInfo.unknown("u", "sql").isSchemaKnown());

		assertEquals(Arrays.asList("b"), d.project("p", Arrays.asList("b", "zz"), "select(d)").getColumnNames());
		assertEquals(Arrays.asList("a", "b", "c"),
				d.withColumn(new ColumnInfo("c", DataType.BOOLEAN)).getColumnNames());
		assertEquals(DataType.STRING, d.withColumn(new ColumnInfo("a", DataType.STRING)).getType("a"));
		assertEquals(Arrays.asList("x", "b"),
				d.renameColumns(Collections.singletonMap("a", "x")).getColumnNames());
		assertEquals(DataType.UNKNOWN, d.getType("missing"));
	}

	@Test
	public void testFromDtype() {
		assertEquals(DataType.NUMERIC, DataType.fromDtype("float64"));
		assertEquals(DataType.NUMERIC, DataType.fromDtype("UInt8"));
		assertEquals(DataType.BOOLEAN, DataType.fromDtype("bool"));
		assertEquals(DataType.STRING, DataType.fromDtype("category"));
		assertEquals(DataType.UNKNOWN, DataType.fromDtype("complex128"));
		assertEquals(DataType.UNKNOWN, DataType.fromDtype(null));
	}
}
