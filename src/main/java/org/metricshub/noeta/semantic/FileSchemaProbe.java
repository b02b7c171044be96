package org.metricshub.noeta.semantic;

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

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.EOFException;
import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import org.apache.parquet.format.ConvertedType;
import org.apache.parquet.format.FieldRepetitionType;
import org.apache.parquet.format.FileMetaData;
import org.apache.parquet.format.LogicalType;
import org.apache.parquet.format.SchemaElement;
import org.apache.parquet.format.Util;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.metricshub.noeta.util.NoetaLogger;
import org.slf4j.Logger;

/**
 * {@link SchemaProbe} reading the columns of local CSV, JSON, Excel and
 * Parquet files.
 * <p>
 * CSV, JSON and Excel column types are inferred from the first rows (or
 * records); Parquet types and nullability come from the schema in the file
 * footer. Reads are bounded: the CSV reader rejects overlong lines, JSON is
 * streamed and abandoned after the sampled records, workbooks above a size
 * limit are skipped and only the Parquet footer is read. Relative paths are
 * resolved against a base directory.
 */
public class FileSchemaProbe implements SchemaProbe {

	private static final Logger LOG = NoetaLogger.getLogger(FileSchemaProbe.class);

	private static final ObjectMapper MAPPER = new ObjectMapper();

	private static final Pattern DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}([ T]\\d{2}:\\d{2}(:\\d{2}(\\.\\d+)?)?)?");

	/** Longest CSV line read, in characters */
	static final int MAX_LINE_CHARS = 1 << 20;

	/** Largest workbook opened, in bytes */
	static final long MAX_WORKBOOK_BYTES = 32L << 20;

	/** Largest Parquet footer read, in bytes */
	static final int MAX_FOOTER_BYTES = 16 << 20;

	private static final String PARQUET_MAGIC = "PAR1";

	private final File baseDirectory;
	private final int sampleRows;

	/**
	 * @param baseDirectory directory of relative paths, {@code null} for the current directory
	 * @param sampleRows number of rows (or records) used to infer types
	 */
	public FileSchemaProbe(File baseDirectory, int sampleRows) {
		this.baseDirectory = baseDirectory;
		this.sampleRows = Math.max(0, sampleRows);
	}

	@Override
	public Map<String, DataType> probe(String path, String format) {
		Map<String, DataType> schema = new LinkedHashMap<String, DataType>();
		for (ColumnInfo column : probeColumns(path, format)) {
			schema.put(column.getName(), column.getType());
		}
		return schema;
	}

	@Override
	public List<ColumnInfo> probeColumns(String path, String format) {
		if (path == null) {
			return Collections.emptyList();
		}
		File file = resolve(path);
		try {
			if ("csv".equals(format)) {
				return probeCsv(file);
			}
			if ("json".equals(format)) {
				return probeJson(file);
			}
			if ("excel".equals(format)) {
				return probeWorkbook(file);
			}
			if ("parquet".equals(format)) {
				return probeParquet(file);
			}
			LOG.debug("No schema probe for format {} of {}", format, path);
		} catch (IOException | RuntimeException e) {
			LOG.debug("Could not read the schema of {}, its columns will not be checked", file, e);
		}
		return Collections.emptyList();
	}

	private File resolve(String path) {
		File file = new File(path);
		if (file.isAbsolute() || baseDirectory == null) {
			return file;
		}
		return new File(baseDirectory, path);
	}

	private List<ColumnInfo> probeCsv(File file) throws IOException {
		try (BufferedReader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
			String header = readLine(reader, MAX_LINE_CHARS);
			if (header == null) {
				return Collections.emptyList();
			}
			if (header.startsWith("\uFEFF")) {
				header = header.substring(1);
			}
			char separator = guessSeparator(header);
			List<String> names = splitCsvLine(header, separator);
			List<DataType> types = new ArrayList<DataType>(Collections.nCopies(names.size(), DataType.UNKNOWN));
			String line;
			int rows = 0;
			while (rows < sampleRows && (line = readLine(reader, MAX_LINE_CHARS)) != null) {
				List<String> cells = splitCsvLine(line, separator);
				for (int i = 0; i < names.size() && i < cells.size(); i++) {
					types.set(i, merge(types.get(i), infer(cells.get(i))));
				}
				rows++;
			}
			List<ColumnInfo> columns = new ArrayList<ColumnInfo>();
			for (int i = 0; i < names.size(); i++) {
				String name = names.get(i).trim();
				if (!name.isEmpty()) {
					columns.add(new ColumnInfo(name, types.get(i)));
				}
			}
			LOG.debug("Probed {} CSV columns in {} from {} rows", columns.size(), file, rows);
			return columns;
		}
	}

	/**
	 * Reads one line ended by {@code \n} or {@code \r\n}.
	 *
	 * @param reader the input
	 * @param limit maximum number of characters of the line
	 * @return the line without its terminator, or {@code null} at the end of the input
	 * @throws IOException when the line is longer than {@code limit}
	 */
	static String readLine(Reader reader, int limit) throws IOException {
		StringBuilder line = new StringBuilder();
		int c;
		while ((c = reader.read()) >= 0) {
			if (c == '\n') {
				return stripCarriageReturn(line);
			}
			if (line.length() >= limit) {
				throw new IOException("Line longer than " + limit + " characters");
			}
			line.append((char) c);
		}
		return line.length() == 0 ? null : stripCarriageReturn(line);
	}

	private static String stripCarriageReturn(StringBuilder line) {
		int length = line.length();
		if (length > 0 && line.charAt(length - 1) == '\r') {
			line.setLength(length - 1);
		}
		return line.toString();
	}

	private List<ColumnInfo> probeJson(File file) throws IOException {
		Map<String, DataType> schema = new LinkedHashMap<String, DataType>();
		try (JsonParser parser = MAPPER.getFactory().createParser(file)) {
			JsonToken root = parser.nextToken();
			if (root == JsonToken.START_ARRAY) {
				// records orientation: [{"a": 1, "b": "x"}, ...]
				int records = 0;
				while (records < sampleRows && parser.nextToken() == JsonToken.START_OBJECT) {
					while (parser.nextToken() == JsonToken.FIELD_NAME) {
						String name = parser.currentName();
						parser.nextToken();
						DataType known = schema.containsKey(name) ? schema.get(name) : DataType.UNKNOWN;
						schema.put(name, merge(known, infer(parser)));
					}
					records++;
				}
			} else if (root == JsonToken.START_OBJECT) {
				// columns orientation: {"a": {"0": 1, "1": 2}, ...}
				while (parser.nextToken() == JsonToken.FIELD_NAME) {
					String name = parser.currentName();
					schema.put(name, inferColumn(parser, parser.nextToken()));
				}
			}
		}
		List<ColumnInfo> columns = new ArrayList<ColumnInfo>();
		for (Map.Entry<String, DataType> column : schema.entrySet()) {
			columns.add(new ColumnInfo(column.getKey(), column.getValue()));
		}
		LOG.debug("Probed {} JSON columns in {}", columns.size(), file);
		return columns;
	}

	/**
	 * Infers the type of one column of a columns-oriented document, the
	 * parser being on the start of its values.
	 */
	private DataType inferColumn(JsonParser parser, JsonToken start) throws IOException {
		if (start != JsonToken.START_OBJECT && start != JsonToken.START_ARRAY) {
			parser.skipChildren();
			return DataType.UNKNOWN;
		}
		JsonToken end = start == JsonToken.START_OBJECT ? JsonToken.END_OBJECT : JsonToken.END_ARRAY;
		DataType type = DataType.UNKNOWN;
		int rows = 0;
		JsonToken token;
		while ((token = parser.nextToken()) != end && token != null) {
			if (token == JsonToken.FIELD_NAME) {
				continue;
			}
			if (rows++ < sampleRows) {
				type = merge(type, infer(parser));
			} else {
				parser.skipChildren();
			}
		}
		return type;
	}

	/**
	 * Type of the JSON value the parser is on. Nested objects and arrays are
	 * skipped and count as strings.
	 */
	private static DataType infer(JsonParser parser) throws IOException {
		JsonToken token = parser.currentToken();
		if (token == null) {
			return DataType.UNKNOWN;
		}
		switch (token) {
		case VALUE_NUMBER_INT:
		case VALUE_NUMBER_FLOAT:
			return DataType.NUMERIC;
		case VALUE_TRUE:
		case VALUE_FALSE:
			return DataType.BOOLEAN;
		case VALUE_STRING:
			return DATE.matcher(parser.getText()).matches() ? DataType.DATETIME : DataType.STRING;
		case VALUE_NULL:
			return DataType.UNKNOWN;
		default:
			parser.skipChildren();
			return DataType.STRING;
		}
	}

	/**
	 * Reads the header row of the first sheet, then infers types from the
	 * cells of the following rows.
	 */
	private List<ColumnInfo> probeWorkbook(File file) throws IOException {
		if (file.length() > MAX_WORKBOOK_BYTES) {
			LOG.debug("Workbook {} is larger than {} bytes, its columns will not be checked", file, MAX_WORKBOOK_BYTES);
			return Collections.emptyList();
		}
		try (Workbook workbook = WorkbookFactory.create(file, null, true)) {
			if (workbook.getNumberOfSheets() == 0) {
				return Collections.emptyList();
			}
			Sheet sheet = workbook.getSheetAt(0);
			Row header = sheet.getRow(sheet.getFirstRowNum());
			if (header == null) {
				return Collections.emptyList();
			}
			DataFormatter formatter = new DataFormatter();
			List<String> names = new ArrayList<String>();
			List<Integer> positions = new ArrayList<Integer>();
			for (Cell cell : header) {
				String name = formatter.formatCellValue(cell).trim();
				if (!name.isEmpty()) {
					names.add(name);
					positions.add(Integer.valueOf(cell.getColumnIndex()));
				}
			}
			List<DataType> types = new ArrayList<DataType>(Collections.nCopies(names.size(), DataType.UNKNOWN));
			int last = Math.min(sheet.getLastRowNum(), header.getRowNum() + sampleRows);
			for (int r = header.getRowNum() + 1; r <= last; r++) {
				Row row = sheet.getRow(r);
				if (row == null) {
					continue;
				}
				for (int i = 0; i < names.size(); i++) {
					types.set(i, merge(types.get(i), infer(row.getCell(positions.get(i).intValue()))));
				}
			}
			List<ColumnInfo> columns = new ArrayList<ColumnInfo>();
			for (int i = 0; i < names.size(); i++) {
				columns.add(new ColumnInfo(names.get(i), types.get(i)));
			}
			LOG.debug("Probed {} workbook columns in {}", columns.size(), file);
			return columns;
		}
	}

	static DataType infer(Cell cell) {
		if (cell == null) {
			return DataType.UNKNOWN;
		}
		CellType type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
		switch (type) {
		case NUMERIC:
			return DateUtil.isCellDateFormatted(cell) ? DataType.DATETIME : DataType.NUMERIC;
		case BOOLEAN:
			return DataType.BOOLEAN;
		case STRING:
			return cell.getStringCellValue().trim().isEmpty() ? DataType.UNKNOWN : DataType.STRING;
		default:
			return DataType.UNKNOWN;
		}
	}

	/**
	 * Reads the schema from the Thrift-encoded footer:
	 * {@code PAR1 <data> <footer> <footer length, 4 bytes little-endian> PAR1}.
	 * Only the top-level fields become columns.
	 */
	private List<ColumnInfo> probeParquet(File file) throws IOException {
		FileMetaData metadata;
		try (FileChannel channel = FileChannel.open(file.toPath(), StandardOpenOption.READ)) {
			long size = channel.size();
			if (size < 12) {
				throw new IOException("Not a Parquet file: " + file);
			}
			ByteBuffer head = ByteBuffer.allocate(4);
			readFully(channel, head, 0);
			ByteBuffer tail = ByteBuffer.allocate(8).order(ByteOrder.LITTLE_ENDIAN);
			readFully(channel, tail, size - 8);
			if (!PARQUET_MAGIC.equals(new String(head.array(), StandardCharsets.US_ASCII))
					|| !PARQUET_MAGIC.equals(new String(tail.array(), 4, 4, StandardCharsets.US_ASCII))) {
				throw new IOException("Not a Parquet file: " + file);
			}
			int footerLength = tail.getInt(0);
			if (footerLength <= 0 || footerLength > size - 12 || footerLength > MAX_FOOTER_BYTES) {
				throw new IOException("Invalid Parquet footer length " + footerLength + " in " + file);
			}
			ByteBuffer footer = ByteBuffer.allocate(footerLength);
			readFully(channel, footer, size - 8 - footerLength);
			metadata = Util.readFileMetaData(new ByteArrayInputStream(footer.array()));
		}
		List<SchemaElement> elements = metadata.getSchema();
		if (elements == null || elements.isEmpty()) {
			return Collections.emptyList();
		}
		SchemaElement root = elements.get(0);
		int fields = root.isSetNum_children() ? root.getNum_children() : 0;
		List<ColumnInfo> columns = new ArrayList<ColumnInfo>();
		int index = 1;
		for (int i = 0; i < fields; i++) {
			if (index >= elements.size()) {
				throw new IOException("Truncated Parquet schema in " + file);
			}
			SchemaElement element = elements.get(index);
			boolean nullable = !element.isSetRepetition_type()
					|| element.getRepetition_type() != FieldRepetitionType.REQUIRED;
			columns.add(new ColumnInfo(element.getName(), typeOf(element), nullable));
			index = skip(elements, index, file);
		}
		LOG.debug("Probed {} Parquet columns in {}", columns.size(), file);
		return columns;
	}

	private static void readFully(FileChannel channel, ByteBuffer buffer, long position) throws IOException {
		long offset = position;
		while (buffer.hasRemaining()) {
			int read = channel.read(buffer, offset);
			if (read < 0) {
				throw new EOFException("Unexpected end of file at " + offset);
			}
			offset += read;
		}
	}

	/**
	 * @return index of the element following the subtree of the element at {@code index}
	 */
	private static int skip(List<SchemaElement> elements, int index, File file) throws IOException {
		if (index >= elements.size()) {
			throw new IOException("Truncated Parquet schema in " + file);
		}
		SchemaElement element = elements.get(index);
		int children = element.isSetNum_children() ? element.getNum_children() : 0;
		int next = index + 1;
		for (int i = 0; i < children; i++) {
			next = skip(elements, next, file);
		}
		return next;
	}

	/**
	 * Maps a Parquet field to a column type: groups are unknown, then the
	 * logical type, the legacy converted type and the physical type decide,
	 * in that order.
	 */
	static DataType typeOf(SchemaElement element) {
		if ((element.isSetNum_children() && element.getNum_children() > 0) || !element.isSetType()) {
			return DataType.UNKNOWN;
		}
		if (element.isSetLogicalType()) {
			LogicalType logical = element.getLogicalType();
			if (logical.isSetSTRING() || logical.isSetENUM() || logical.isSetJSON() || logical.isSetUUID()) {
				return DataType.STRING;
			}
			if (logical.isSetDATE() || logical.isSetTIMESTAMP()) {
				return DataType.DATETIME;
			}
			if (logical.isSetDECIMAL() || logical.isSetINTEGER()) {
				return DataType.NUMERIC;
			}
		}
		if (element.isSetConverted_type()) {
			ConvertedType converted = element.getConverted_type();
			switch (converted) {
			case UTF8:
			case ENUM:
			case JSON:
				return DataType.STRING;
			case DATE:
			case TIMESTAMP_MILLIS:
			case TIMESTAMP_MICROS:
				return DataType.DATETIME;
			case DECIMAL:
			case INT_8:
			case INT_16:
			case INT_32:
			case INT_64:
			case UINT_8:
			case UINT_16:
			case UINT_32:
			case UINT_64:
				return DataType.NUMERIC;
			default:
				break;
			}
		}
		switch (element.getType()) {
		case BOOLEAN:
			return DataType.BOOLEAN;
		case INT32:
		case INT64:
		case FLOAT:
		case DOUBLE:
			return DataType.NUMERIC;
		case INT96:
			return DataType.DATETIME;
		default:
			// raw binary
			return DataType.STRING;
		}
	}

	private static char guessSeparator(String header) {
		if (header.indexOf(',') >= 0) {
			return ',';
		}
		if (header.indexOf(';') >= 0) {
			return ';';
		}
		if (header.indexOf('\t') >= 0) {
			return '\t';
		}
		return ',';
	}

	/**
	 * Splits one CSV line, honoring double-quoted cells and doubled quotes.
	 */
	static List<String> splitCsvLine(String line, char separator) {
		List<String> cells = new ArrayList<String>();
		StringBuilder cell = new StringBuilder();
		boolean quoted = false;
		for (int i = 0; i < line.length(); i++) {
			char c = line.charAt(i);
			if (quoted) {
				if (c == '"' && i + 1 < line.length() && line.charAt(i + 1) == '"') {
					cell.append('"');
					i++;
				} else if (c == '"') {
					quoted = false;
				} else {
					cell.append(c);
				}
			} else if (c == '"') {
				quoted = true;
			} else if (c == separator) {
				cells.add(cell.toString());
				cell.setLength(0);
			} else {
				cell.append(c);
			}
		}
		cells.add(cell.toString());
		return cells;
	}

	static DataType infer(String cell) {
		String value = cell.trim();
		if (value.isEmpty()) {
			return DataType.UNKNOWN;
		}
		String lower = value.toLowerCase(Locale.ROOT);
		if ("true".equals(lower) || "false".equals(lower)) {
			return DataType.BOOLEAN;
		}
		if ("nan".equals(lower) || "na".equals(lower) || "null".equals(lower)) {
			return DataType.UNKNOWN;
		}
		try {
			Double.parseDouble(value);
			return DataType.NUMERIC;
		} catch (NumberFormatException e) {
			// not a number, try the other types
			LOG.trace("Cell {} is not numeric", value);
		}
		if (DATE.matcher(value).matches()) {
			return DataType.DATETIME;
		}
		return DataType.STRING;
	}

	/**
	 * Combines the type seen so far with the type of one more value: unknown
	 * values (empty cells, nulls) do not change the type, and disagreeing
	 * values make the column a string column.
	 */
	static DataType merge(DataType current, DataType next) {
		if (current == DataType.UNKNOWN) {
			return next;
		}
		if (next == DataType.UNKNOWN || next == current) {
			return current;
		}
		return DataType.STRING;
	}
}
