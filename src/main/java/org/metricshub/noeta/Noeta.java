package org.metricshub.noeta;

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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.util.Collections;
import java.util.List;
import org.metricshub.noeta.backend.CodeGenerator;
import org.metricshub.noeta.diagnostics.Diagnostic;
import org.metricshub.noeta.diagnostics.NoetaException;
import org.metricshub.noeta.frontend.NoetaLexer;
import org.metricshub.noeta.frontend.NoetaParser;
import org.metricshub.noeta.frontend.Token;
import org.metricshub.noeta.frontend.ast.Program;
import org.metricshub.noeta.semantic.SemanticAnalyzer;
import org.metricshub.noeta.semantic.SymbolTable;
import org.metricshub.noeta.util.NoetaLogger;
import org.metricshub.noeta.util.NoetaSettings;
import org.metricshub.noeta.util.ScriptSource;
import org.slf4j.Logger;

/**
 * Entry point of the Noeta compiler.
 * <p>
 * A compilation runs four phases in sequence: the {@link NoetaLexer} turns
 * the program text into tokens, the {@link NoetaParser} builds the
 * {@link Program}, the {@link SemanticAnalyzer} checks every dataset and
 * column reference, and the {@link CodeGenerator} renders the Python script.
 * <p>
 * Lexical and syntax errors abort the compilation at once. Semantic errors
 * are collected over the whole program and raised together as one
 * {@link NoetaException}.
 * <p>
 * An instance is not thread-safe; the symbol table passed to
 * {@link #compile(String, SymbolTable)} is updated in place and callers
 * sharing it must serialize their compilations.
 */
public class Noeta {

	private static final Logger LOG = NoetaLogger.getLogger(Noeta.class);

	private final NoetaSettings settings;

	/**
	 * The last parsed {@link Program} produced during compilation.
	 */
	private Program lastProgram;

	/**
	 * The symbol table of the last analysis.
	 */
	private SymbolTable lastSymbolTable;

	/**
	 * Create a new compiler with default settings
	 */
	public Noeta() {
		this(new NoetaSettings());
	}

	/**
	 * @param settings compilation settings
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Noeta(NoetaSettings settings) {
		this.settings = settings;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP")
	public NoetaSettings getSettings() {
		return settings;
	}

	/**
	 * Returns the last parsed program produced by one of the compile methods.
	 *
	 * @return the last {@link Program}, or {@code null} if nothing was parsed
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public Program getLastProgram() {
		return lastProgram;
	}

	/**
	 * @return the symbol table of the last analysis, or {@code null} if no
	 *         program reached the analyzer
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public SymbolTable getLastSymbolTable() {
		return lastSymbolTable;
	}

	/**
	 * Tokenizes and parses a program without analyzing it.
	 *
	 * @param code program text
	 * @return the parsed program
	 * @throws NoetaException on the first lexical or syntax error
	 */
	public Program parse(String code) {
		List<Token> tokens = new NoetaLexer(code).tokenize();
		LOG.debug("Tokenized {} tokens", tokens.size());
		lastProgram = new NoetaParser(tokens, code).parse();
		return lastProgram;
	}

	/**
	 * Compiles a program against a fresh symbol table.
	 *
	 * @param code program text
	 * @return the generated Python script
	 * @throws NoetaException if the program has errors
	 */
	public String compile(String code) {
		return compile(code, new SymbolTable());
	}

	/**
	 * Compiles a program against the datasets defined by earlier compilations.
	 * The table receives the datasets this program defines, even when the
	 * program turns out to have errors further down.
	 *
	 * @param code program text
	 * @param symbolTable datasets carried over from earlier compilations
	 * @return the generated Python script
	 * @throws NoetaException if the program has errors
	 */
	public String compile(String code, SymbolTable symbolTable) {
		Program program = parse(code);

		SemanticAnalyzer analyzer = new SemanticAnalyzer(settings, code);
		List<Diagnostic> diagnostics = analyzer.analyze(program, symbolTable);
		lastSymbolTable = analyzer.getSymbolTable();
		if (!diagnostics.isEmpty()) {
			LOG.debug("Compilation failed with {} diagnostics", diagnostics.size());
			throw new NoetaException(diagnostics);
		}

		String script = new CodeGenerator().generate(program);
		LOG.debug("Compiled {} statements", program.size());
		return script;
	}

	/**
	 * Compiles a single {@link ScriptSource}.
	 *
	 * @param script program source
	 * @return the generated Python script
	 * @throws IOException if the source cannot be read
	 * @throws NoetaException if the program has errors
	 */
	public String compile(ScriptSource script) throws IOException {
		return compile(Collections.singletonList(script));
	}

	/**
	 * Compiles the concatenation of several sources, in order, as one program.
	 *
	 * @param scripts program sources
	 * @return the generated Python script
	 * @throws IOException if a source cannot be read
	 * @throws NoetaException if the program has errors
	 */
	public String compile(List<ScriptSource> scripts) throws IOException {
		return compile(read(scripts));
	}

	/**
	 * @param scripts program sources
	 * @return the sources joined by line breaks
	 * @throws IOException if a source cannot be read
	 */
	static String read(List<ScriptSource> scripts) throws IOException {
		StringBuilder code = new StringBuilder();
		for (ScriptSource script : scripts) {
			if (code.length() > 0) {
				code.append('\n');
			}
			code.append(script.readAll());
		}
		return code.toString();
	}
}
