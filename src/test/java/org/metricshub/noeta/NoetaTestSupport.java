package org.metricshub.noeta;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import org.metricshub.noeta.diagnostics.ErrorCategory;
import org.metricshub.noeta.diagnostics.NoetaException;
import org.metricshub.noeta.frontend.NoetaLexer;
import org.metricshub.noeta.frontend.NoetaParser;
import org.metricshub.noeta.frontend.ast.Program;
import org.metricshub.noeta.frontend.ast.Statement;
import org.metricshub.noeta.semantic.SchemaProbe;
import org.metricshub.noeta.semantic.SymbolTable;
import org.metricshub.noeta.util.NoetaSettings;

/**
 * Helpers shared by the compiler tests. Programs are given line by line;
 * {@link #noetaTest(String)} returns a fluent builder that compiles them and
 * checks the generated script or the reported diagnostics.
 */
public final class NoetaTestSupport {

	private NoetaTestSupport() {}

	/**
	 * @param lines program lines
	 * @return the parsed program
	 */
	public static Program parse(String... lines) {
		String code = String.join("\n", lines);
		return new NoetaParser(new NoetaLexer(code).tokenize(), code).parse();
	}

	/**
	 * @param lines program lines of exactly one statement
	 * @return the statement
	 */
	public static Statement statement(String... lines) {
		Program program = parse(lines);
		assertEquals("statement count", 1, program.size());
		return program.getStatements().get(0);
	}

	public static NoetaTestBuilder noetaTest(String description) {
		return new NoetaTestBuilder(description);
	}

	public static final class NoetaTestBuilder {

		private final String description;
		private final NoetaSettings settings = new NoetaSettings();
		private String code = "";
		private SymbolTable symbolTable = new SymbolTable();

		private NoetaTestBuilder(String description) {
			this.description = description;
		}

		public NoetaTestBuilder script(String... lines) {
			this.code = String.join("\n", lines);
			return this;
		}

		public NoetaTestBuilder withSymbolTable(SymbolTable table) {
			this.symbolTable = table;
			return this;
		}

		public NoetaTestBuilder typeCheck(SchemaProbe columns) {
			settings.setTypeCheck(true);
			settings.setSchemaProbe(columns);
			return this;
		}

		/**
		 * @return the generated script
		 */
		public String compile() {
			return new Noeta(settings).compile(code, symbolTable);
		}

		/**
		 * Compiles and checks that the script contains every fragment.
		 *
		 * @return the generated script
		 */
		public String expectContains(String... fragments) {
			String script = compile();
			for (String fragment : fragments) {
				assertTrue(description + ": missing <" + fragment + "> in\n" + script, script.contains(fragment));
			}
			return script;
		}

		/**
		 * Compiles and checks that the compilation fails.
		 *
		 * @return the raised exception
		 */
		public NoetaException expectFailure() {
			return assertThrows(description, NoetaException.class, this::compile);
		}

		/**
		 * Compiles and checks that it fails with the given number of
		 * diagnostics, all of the given category.
		 *
		 * @return the raised exception
		 */
		public NoetaException expectDiagnostics(ErrorCategory category, int count) {
			NoetaException e = expectFailure();
			assertEquals(description + ": diagnostics in\n" + e.getMessage(), count, e.getDiagnostics().size());
			for (int i = 0; i < count; i++) {
				assertEquals(description, category, e.getDiagnostics().get(i).getCategory());
			}
			return e;
		}
	}
}
