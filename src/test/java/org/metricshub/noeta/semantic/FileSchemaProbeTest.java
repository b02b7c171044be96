package org.metricshub.noeta.semantic;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.io.StringReader;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.apache.parquet.format.ConvertedType;
import org.apache.parquet.format.DateType;
import org.apache.parquet.format.FieldRepetitionType;
import org.apache.parquet.format.FileMetaData;
import org.apache.parquet.format.LogicalType;
import org.apache.parquet.format.RowGroup;
import org.apache.parquet.format.SchemaElement;
import org.apache.parquet.format.Type;
import org.apache.parquet.format.Util;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class FileSchemaProbeTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private File write(String name, String content) throws IOException {
		File file = folder.newFile(name);
		Files.write(file.toPath(), content.getBytes(StandardCharsets.UTF_8));
		return file;
	}

	private File writeParquet(String name, SchemaElement... schema) throws IOException {
		FileMetaData metadata = new FileMetaData(1, Arrays.asList(schema), 0L, new ArrayList<RowGroup>());
		ByteArrayOutputStream footer = new ByteArrayOutputStream();
		Util.writeFileMetaData(metadata, footer);
		ByteArrayOutputStream content = new ByteArrayOutputStream();
		content.write("PAR1".getBytes(StandardCharsets.US_ASCII));
		footer.writeTo(content);
		content.write(ByteBuffer.allocate(4).order(ByteOrder.LITTLE_ENDIAN).putInt(footer.size()).array());
		content.write("PAR1".getBytes(StandardCharsets.US_ASCII));
		File file = folder.newFile(name);
		Files.write(file.toPath(), content.toByteArray());
		return file;
	}

	private static SchemaElement field(String name, Type type, FieldRepetitionType repetition) {
		return new SchemaElement(name).setType(type).setRepetition_type(repetition);
	}

	@Test
	public void testCsv() throws IOException {
		write("sales.csv", "\uFEFFid,name,price,sold_on,active\n"
				+ "1,\"Widget, large\",9.5,2024-01-31,true\n"
				+ "2,Gadget,,2024-02-01,false\n");
		Map<String, DataType> schema = new FileSchemaProbe(folder.getRoot(), 100).probe("sales.csv", "csv");

		assertEquals(Arrays.asList("id", "name", "price", "sold_on", "active"), new ArrayList<String>(schema.keySet()));
		assertEquals(DataType.NUMERIC, schema.get("id"));
		assertEquals(DataType.STRING, schema.get("name"));
		assertEquals(DataType.NUMERIC, schema.get("price"));
		assertEquals(DataType.DATETIME, schema.get("sold_on"));
		assertEquals(DataType.BOOLEAN, schema.get("active"));
	}

	@Test
	public void testCsvSemicolonSeparator() throws IOException {
		File file = write("eu.csv", "a;b\n1;x\n");
		Map<String, DataType> schema = new FileSchemaProbe(null, 10).probe(file.getAbsolutePath(), "csv");
		assertEquals(DataType.NUMERIC, schema.get("a"));
		assertEquals(DataType.STRING, schema.get("b"));
	}

	@Test
	public void testSampleRowsLimitInference() throws IOException {
		write("mixed.csv", "code\n1\n2\nA-3\n");
		assertEquals(DataType.NUMERIC, new FileSchemaProbe(folder.getRoot(), 2).probe("mixed.csv", "csv").get("code"));
		assertEquals(DataType.STRING, new FileSchemaProbe(folder.getRoot(), 10).probe("mixed.csv", "csv").get("code"));
	}

	@Test
	public void testJsonRecords() throws IOException {
		write("people.json", "[{\"name\": \"Ann\", \"age\": 31, \"born\": \"1993-04-02\"}, {\"name\": \"Bob\", \"age\": null}]");
		Map<String, DataType> schema = new FileSchemaProbe(folder.getRoot(), 100).probe("people.json", "json");
		assertEquals(Arrays.asList("name", "age", "born"), new ArrayList<String>(schema.keySet()));
		assertEquals(DataType.STRING, schema.get("name"));
		assertEquals(DataType.NUMERIC, schema.get("age"));
		assertEquals(DataType.DATETIME, schema.get("born"));
	}

	@Test
	public void testJsonColumns() throws IOException {
		write("cols.json", "{\"flag\": {\"0\": true, \"1\": false}, \"v\": {\"0\": 1.5}}");
		Map<String, DataType> schema = new FileSchemaProbe(folder.getRoot(), 100).probe("cols.json", "json");
		assertEquals(DataType.BOOLEAN, schema.get("flag"));
		assertEquals(DataType.NUMERIC, schema.get("v"));
	}

	@Test
	public void testUnreadableSourcesYieldEmptySchema() throws IOException {
		FileSchemaProbe files = new FileSchemaProbe(folder.getRoot(), 100);
		assertTrue(files.probe("missing.csv", "csv").isEmpty());
		assertTrue(files.probe(null, "csv").isEmpty());
		write("broken.json", "{not json");
		assertTrue(files.probe("broken.json", "json").isEmpty());
		write("short.parquet", "PAR1");
		assertTrue(files.probe("short.parquet", "parquet").isEmpty());
		write("fake.parquet", "PAR1 not a footer PAR1");
		assertTrue(files.probe("fake.parquet", "parquet").isEmpty());
		write("text.parquet", "just some text, long enough");
		assertTrue(files.probe("text.parquet", "parquet").isEmpty());
		assertTrue(files.probe("missing.parquet", "parquet").isEmpty());
		write("fake.xlsx", "not a workbook");
		assertTrue(files.probe("fake.xlsx", "excel").isEmpty());
		write("empty.csv", "");
		assertTrue(files.probe("empty.csv", "csv").isEmpty());
		assertTrue(files.probe("select 1", "sql").isEmpty());
	}

	@Test
	public void testOverlongCsvHeaderYieldsEmptySchema() throws IOException {
		char[] header = new char[FileSchemaProbe.MAX_LINE_CHARS + 1];
		Arrays.fill(header, 'a');
		write("wide.csv", new String(header) + "\n1\n");
		assertTrue(new FileSchemaProbe(folder.getRoot(), 100).probe("wide.csv", "csv").isEmpty());
	}

	@Test
	public void testReadLine() throws IOException {
		StringReader reader = new StringReader("a,b\r\n\nlast");
		assertEquals("a,b", FileSchemaProbe.readLine(reader, 10));
		assertEquals("", FileSchemaProbe.readLine(reader, 10));
		assertEquals("last", FileSchemaProbe.readLine(reader, 10));
		assertNull(FileSchemaProbe.readLine(reader, 10));
		assertThrows(IOException.class, () -> FileSchemaProbe.readLine(new StringReader("abcdef\n"), 3));
	}

	@Test
	public void testJsonRecordsAfterSampleAreNotRead() throws IOException {
		// the second record is malformed and lies beyond the sampled rows
		write("stream.json", "[{\"code\": 1}, {\"code\": \"x\"}, {not json");
		assertEquals(DataType.NUMERIC, new FileSchemaProbe(folder.getRoot(), 1).probe("stream.json", "json").get("code"));
		assertTrue(new FileSchemaProbe(folder.getRoot(), 10).probe("stream.json", "json").isEmpty());
	}

	@Test
	public void testJsonColumnsSampleRows() throws IOException {
		write("sampled.json", "{\"code\": [1, 2, \"x\"], \"nested\": {\"0\": {\"a\": 1}}, \"scalar\": 3}");
		Map<String, DataType> schema = new FileSchemaProbe(folder.getRoot(), 2).probe("sampled.json", "json");
		assertEquals(Arrays.asList("code", "nested", "scalar"), new ArrayList<String>(schema.keySet()));
		assertEquals(DataType.NUMERIC, schema.get("code"));
		assertEquals(DataType.STRING, schema.get("nested"));
		assertEquals(DataType.UNKNOWN, schema.get("scalar"));
		assertEquals(DataType.STRING, new FileSchemaProbe(folder.getRoot(), 3).probe("sampled.json", "json").get("code"));
	}

	@Test
	public void testExcel() throws IOException {
		File file = folder.newFile("sales.xlsx");
		try (XSSFWorkbook workbook = new XSSFWorkbook()) {
			CellStyle dateStyle = workbook.createCellStyle();
			dateStyle.setDataFormat(workbook.getCreationHelper().createDataFormat().getFormat("yyyy-mm-dd"));
			Sheet sheet = workbook.createSheet("Sales");
			Row header = sheet.createRow(0);
			header.createCell(0).setCellValue("id");
			header.createCell(1).setCellValue("name");
			header.createCell(2).setCellValue("sold_on");
			header.createCell(3).setCellValue("active");
			header.createCell(4).setCellValue("comment");
			Row first = sheet.createRow(1);
			first.createCell(0).setCellValue(1);
			first.createCell(1).setCellValue("Widget");
			first.createCell(2).setCellValue(LocalDate.of(2024, 1, 31));
			first.getCell(2).setCellStyle(dateStyle);
			first.createCell(3).setCellValue(true);
			Row second = sheet.createRow(2);
			second.createCell(0).setCellValue(2.5);
			second.createCell(1).setCellValue(42);
			second.createCell(4).setCellValue("late");
			try (OutputStream out = Files.newOutputStream(file.toPath())) {
				workbook.write(out);
			}
		}

		List<ColumnInfo> columns = new FileSchemaProbe(folder.getRoot(), 100).probeColumns("sales.xlsx", "excel");
		assertEquals(5, columns.size());
		assertEquals("id", columns.get(0).getName());
		assertEquals(DataType.NUMERIC, columns.get(0).getType());
		assertEquals(DataType.STRING, columns.get(1).getType());
		assertEquals(DataType.DATETIME, columns.get(2).getType());
		assertEquals(DataType.BOOLEAN, columns.get(3).getType());
		assertEquals(DataType.STRING, columns.get(4).getType());
		assertTrue(columns.get(0).isNullable());

		Map<String, DataType> firstRowOnly = new FileSchemaProbe(folder.getRoot(), 1).probe("sales.xlsx", "excel");
		assertEquals(DataType.NUMERIC, firstRowOnly.get("id"));
		assertEquals(DataType.UNKNOWN, firstRowOnly.get("comment"));
	}

	@Test
	public void testParquetFooterSchema() throws IOException {
		writeParquet("sales.parquet",
				new SchemaElement("schema").setNum_children(6),
				field("id", Type.INT64, FieldRepetitionType.REQUIRED),
				field("name", Type.BYTE_ARRAY, FieldRepetitionType.OPTIONAL).setConverted_type(ConvertedType.UTF8),
				field("sold_on", Type.INT32, FieldRepetitionType.OPTIONAL).setLogicalType(LogicalType.DATE(new DateType())),
				field("active", Type.BOOLEAN, FieldRepetitionType.REQUIRED),
				new SchemaElement("address").setRepetition_type(FieldRepetitionType.OPTIONAL).setNum_children(2),
				field("street", Type.BYTE_ARRAY, FieldRepetitionType.REQUIRED).setConverted_type(ConvertedType.UTF8),
				field("zip", Type.INT32, FieldRepetitionType.OPTIONAL),
				field("price", Type.DOUBLE, FieldRepetitionType.OPTIONAL));

		List<ColumnInfo> columns = new FileSchemaProbe(folder.getRoot(), 100).probeColumns("sales.parquet", "parquet");
		List<String> names = new ArrayList<String>();
		for (ColumnInfo column : columns) {
			names.add(column.getName());
		}
		assertEquals(Arrays.asList("id", "name", "sold_on", "active", "address", "price"), names);
		assertEquals(DataType.NUMERIC, columns.get(0).getType());
		assertFalse(columns.get(0).isNullable());
		assertEquals(DataType.STRING, columns.get(1).getType());
		assertTrue(columns.get(1).isNullable());
		assertEquals(DataType.DATETIME, columns.get(2).getType());
		assertEquals(DataType.BOOLEAN, columns.get(3).getType());
		assertFalse(columns.get(3).isNullable());
		assertEquals(DataType.UNKNOWN, columns.get(4).getType());
		assertTrue(columns.get(4).isNullable());
		assertEquals(DataType.NUMERIC, columns.get(5).getType());
	}

	@Test
	public void testTruncatedParquetSchemaYieldsEmptySchema() throws IOException {
		writeParquet("cut.parquet",
				new SchemaElement("schema").setNum_children(3),
				field("id", Type.INT64, FieldRepetitionType.REQUIRED));
		assertTrue(new FileSchemaProbe(folder.getRoot(), 100).probeColumns("cut.parquet", "parquet").isEmpty());
	}

	@Test
	public void testParquetTypeMapping() {
		assertEquals(DataType.DATETIME, FileSchemaProbe.typeOf(new SchemaElement("t").setType(Type.INT96)));
		assertEquals(DataType.NUMERIC,
				FileSchemaProbe.typeOf(new SchemaElement("d").setType(Type.FIXED_LEN_BYTE_ARRAY).setConverted_type(ConvertedType.DECIMAL)));
		assertEquals(DataType.STRING, FileSchemaProbe.typeOf(new SchemaElement("b").setType(Type.BYTE_ARRAY)));
		assertEquals(DataType.UNKNOWN, FileSchemaProbe.typeOf(new SchemaElement("g")));
	}

	@Test
	public void testDefaultColumnsAreNullable() {
		SchemaProbe fixed = (path, format) -> Collections.singletonMap("id", DataType.NUMERIC);
		List<ColumnInfo> columns = fixed.probeColumns("any.csv", "csv");
		assertEquals(1, columns.size());
		assertEquals("id", columns.get(0).getName());
		assertEquals(DataType.NUMERIC, columns.get(0).getType());
		assertTrue(columns.get(0).isNullable());
	}

	@Test
	public void testSplitCsvLine() {
		assertEquals(Arrays.asList("a", "b, c", "say \"hi\"", ""),
				FileSchemaProbe.splitCsvLine("a,\"b, c\",\"say \"\"hi\"\"\",", ','));
	}

	@Test
	public void testInfer() {
		assertEquals(DataType.NUMERIC, FileSchemaProbe.infer("-1.5e3"));
		assertEquals(DataType.DATETIME, FileSchemaProbe.infer("2024-05-06 10:30:00"));
		assertEquals(DataType.BOOLEAN, FileSchemaProbe.infer("TRUE"));
		assertEquals(DataType.UNKNOWN, FileSchemaProbe.infer(" "));
		assertEquals(DataType.UNKNOWN, FileSchemaProbe.infer("NaN"));
		assertEquals(DataType.STRING, FileSchemaProbe.infer("hello"));
	}

	@Test
	public void testMerge() {
		assertEquals(DataType.NUMERIC, FileSchemaProbe.merge(DataType.UNKNOWN, DataType.NUMERIC));
		assertEquals(DataType.NUMERIC, FileSchemaProbe.merge(DataType.NUMERIC, DataType.UNKNOWN));
		assertEquals(DataType.STRING, FileSchemaProbe.merge(DataType.NUMERIC, DataType.DATETIME));
	}
}
