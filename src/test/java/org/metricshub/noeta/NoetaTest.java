package org.metricshub.noeta;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;
import static org.metricshub.noeta.NoetaTestSupport.noetaTest;

import java.io.IOException;
import java.util.Arrays;
import org.junit.Test;
import org.metricshub.noeta.diagnostics.ErrorCategory;
import org.metricshub.noeta.diagnostics.NoetaException;
import org.metricshub.noeta.frontend.LexerException;
import org.metricshub.noeta.frontend.ParserException;
import org.metricshub.noeta.semantic.SymbolTable;
import org.metricshub.noeta.util.ScriptSource;

public class NoetaTest {

	@Test
	public void testCompile() {
		noetaTest("load and describe")
				.script("load \"sales.csv\" as sales", "describe sales")
				.expectContains("import pandas as pd", "sales = pd.read_csv('sales.csv')", "print(sales.describe())");
	}

	@Test
	public void testUnterminatedString() {
		NoetaException e = noetaTest("unterminated string").script("load \"data.csv as d").expectFailure();
		assertTrue(e instanceof LexerException);
		assertEquals(ErrorCategory.LEXICAL, e.getCategory());
	}

	@Test
	public void testSyntaxErrorAbortsCompilation() {
		NoetaException e = noetaTest("missing alias").script("load \"a.csv\"", "describe missing").expectFailure();
		assertTrue(e instanceof ParserException);
		assertEquals(1, e.getDiagnostics().size());
		assertEquals(ErrorCategory.SYNTAX, e.getCategory());
	}

	@Test
	public void testSemanticErrorsAreReportedTogether() {
		NoetaException e = noetaTest("two undefined datasets")
				.script("load \"a.csv\" as a", "describe b", "head c")
				.expectDiagnostics(ErrorCategory.SEMANTIC, 2);
		assertTrue(e.getMessage(), e.getMessage().startsWith("Found 2 errors in compilation:"));
		assertTrue(e.getMessage(), e.getMessage().contains("Dataset 'b' has not been loaded or created"));
		assertTrue(e.getMessage(), e.getMessage().contains("Available datasets: a"));
	}

	@Test
	public void testSymbolTableCarriesOver() {
		SymbolTable table = new SymbolTable();
		noetaTest("first cell").script("load \"a.csv\" as a").withSymbolTable(table).compile();
		assertTrue(table.exists("a"));

		noetaTest("second cell")
				.script("head a with n=3 as top")
				.withSymbolTable(table)
				.expectContains("top = a.head(3)");
		assertEquals(Arrays.asList("a", "top"), table.getAllNames());

		noetaTest("fresh table").script("head a").expectDiagnostics(ErrorCategory.SEMANTIC, 1);
	}

	@Test
	public void testCompilationIsRepeatable() {
		String code = String.join("\n", "load \"sales.csv\" as sales",
				"filter sales where price > 10 as cheap",
				"groupby cheap by region compute {sum: price} as totals",
				"cumsum sales column price as running",
				"mutate running with twice = price * 2 as m",
				"head m with n=99999999999999999999999 as top",
				"load \"autres.csv\" as données",
				"describe données");
		String first = new Noeta().compile(code, new SymbolTable());
		assertEquals(first, new Noeta().compile(code, new SymbolTable()));

		Noeta noeta = new Noeta();
		assertEquals(first, noeta.compile(code, new SymbolTable()));
		assertEquals(first, noeta.compile(code, new SymbolTable()));

		assertTrue(first, first.contains("top = m.head(99999999999999999999999)"));
		assertTrue(first, first.contains("données = pd.read_csv('autres.csv')"));
		assertTrue(first, first.contains("print(données.describe())"));
	}

	@Test
	public void testFailedCompilationKeepsEarlierDefinitions() {
		SymbolTable table = new SymbolTable();
		noetaTest("partial").script("load \"a.csv\" as a", "describe nope").withSymbolTable(table).expectFailure();
		assertTrue(table.exists("a"));
	}

	@Test
	public void testLastProgramAndSymbolTable() {
		Noeta noeta = new Noeta();
		assertNull(noeta.getLastProgram());
		assertNull(noeta.getLastSymbolTable());

		noeta.compile("load \"a.csv\" as a\nsort a by x as s");
		assertEquals(2, noeta.getLastProgram().size());
		assertNotNull(noeta.getLastSymbolTable());
		assertTrue(noeta.getLastSymbolTable().exists("s"));

		assertEquals(1, noeta.parse("describe anything").size());
		assertEquals(1, noeta.getLastProgram().size());
	}

	@Test
	public void testCompileSources() throws IOException {
		Noeta noeta = new Noeta();
		String single = noeta.compile(ScriptSource.of("load \"a.csv\" as a"));
		assertTrue(single.contains("a = pd.read_csv('a.csv')"));

		String joined = noeta.compile(Arrays.asList(ScriptSource.of("load \"a.csv\" as a"), ScriptSource.of("describe a")));
		assertTrue(joined.contains("print(a.describe())"));
		assertEquals(2, noeta.getLastProgram().size());

		assertThrows(NoetaException.class, () -> noeta.compile(Arrays.asList(ScriptSource.of("describe a"))));
	}
}
