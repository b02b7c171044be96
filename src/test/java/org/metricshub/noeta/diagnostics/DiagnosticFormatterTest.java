package org.metricshub.noeta.diagnostics;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import org.junit.Test;

public class DiagnosticFormatterTest {

	private static final String SOURCE = "select sales 123 as result";

	private static Diagnostic syntax() {
		return Diagnostic
				.builder(ErrorCategory.SYNTAX, "Expected \"with\" keyword, got number 123 in select statement")
				.at(1, 14, 3, SOURCE)
				.hint("Use \"select <dataset> with <col1>, <col2> as <alias>\" to select columns")
				.build();
	}

	@Test
	public void testSingleDiagnostic() {
		String expected = "Syntax Error at line 1, column 14:\n"
				+ "       1 | select sales 123 as result\n"
				+ "                        ^^^\n"
				+ "    Expected \"with\" keyword, got number 123 in select statement\n"
				+ "\n"
				+ "Hint: Use \"select <dataset> with <col1>, <col2> as <alias>\" to select columns";
		assertEquals(expected, DiagnosticFormatter.format(syntax()));
		assertEquals(expected, syntax().format());
	}

	@Test
	public void testSuggestionLine() {
		Diagnostic d = Diagnostic
				.builder(ErrorCategory.SEMANTIC, "Dataset 'sale' has not been loaded or created")
				.at(2, 8, 4, "select sale with price as r")
				.hint("Available datasets: sales")
				.suggestion("sales")
				.build();
		String text = DiagnosticFormatter.format(d);
		assertTrue(text.startsWith("Semantic Error at line 2, column 8:\n"));
		assertTrue(text.endsWith("\nHint: Available datasets: sales\nDid you mean: sales"));
	}

	@Test
	public void testWithoutContext() {
		Diagnostic d = Diagnostic.builder(ErrorCategory.TYPE, "Column 'a' has type string, expected numeric").build();
		assertEquals("Type Error:\n    Column 'a' has type string, expected numeric", DiagnosticFormatter.format(d));
	}

	@Test
	public void testEmptySourceLineIsNotQuoted() {
		Diagnostic d = Diagnostic.builder(ErrorCategory.SYNTAX, "boom").at(3, 1, 1, "").build();
		assertEquals("Syntax Error at line 3, column 1:\n    boom", DiagnosticFormatter.format(d));
	}

	@Test
	public void testBatch() {
		Diagnostic first = Diagnostic
				.builder(ErrorCategory.SEMANTIC, "Dataset 'a' has not been loaded or created")
				.at(1, 8, 1, "select a with x as y")
				.hint("No datasets have been loaded yet")
				.build();
		Diagnostic second = Diagnostic
				.builder(ErrorCategory.TYPE, "Column 'x' has type string, expected numeric")
				.at(2, 14, 1, "round b column x")
				.build();
		Diagnostic third = Diagnostic
				.builder(ErrorCategory.SEMANTIC, "Column 'q' does not exist in dataset 'b'")
				.at(3, 10, 1, "select b with q as c")
				.suggestion("qty")
				.build();

		String text = DiagnosticFormatter.format(Arrays.asList(first, second, third));
		assertTrue(text.startsWith("Found 3 errors in compilation:\n"));
		assertTrue(text.contains("\nSemantic Errors (2):\n"));
		assertTrue(text.contains("\nType Errors (1):\n"));
		// semantic group first, numbering follows the groups
		assertTrue(text.indexOf("[Error 1]") < text.indexOf("Dataset 'a'"));
		assertTrue(text.indexOf("[Error 2]") < text.indexOf("Column 'q'"));
		assertTrue(text.indexOf("Column 'q'") < text.indexOf("[Error 3]"));
		assertTrue(text.contains("  Line 2, column 14:"));
		assertTrue(text.contains("  Hint: No datasets have been loaded yet"));
		assertTrue(text.contains("  Did you mean: qty"));
		assertTrue(text.endsWith("Total: 3 errors found"));
	}

	@Test
	public void testBatchOfOneUsesSingleForm() {
		assertEquals(DiagnosticFormatter.format(syntax()),
				DiagnosticFormatter.format(Collections.singletonList(syntax())));
	}

	@Test
	public void testEmptyBatch() {
		assertEquals("No errors to display", DiagnosticFormatter.format(Collections.<Diagnostic>emptyList()));
	}

	@Test
	public void testException() {
		NoetaException e = new NoetaException(syntax());
		assertEquals(ErrorCategory.SYNTAX, e.getCategory());
		assertEquals(DiagnosticFormatter.format(syntax()), e.getMessage());
		assertThrows(IllegalArgumentException.class, () -> new NoetaException(Collections.<Diagnostic>emptyList()));
	}
}
