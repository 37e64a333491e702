package org.scholargraph.resources.store;

import com.typesafe.config.Config;
import org.duckdb.DuckDBConnection;
import org.scholargraph.api.resources.store.CorpusTable;
import org.scholargraph.api.resources.store.IColumnarStore;
import org.scholargraph.api.resources.store.QueryExecutionException;
import org.scholargraph.api.resources.store.QueryResult;
import org.scholargraph.api.resources.store.Row;
import org.scholargraph.api.resources.store.StoreException;
import org.scholargraph.api.resources.store.StoreUnavailableException;
import org.scholargraph.resources.AbstractResource;
import org.scholargraph.utils.PathExpansion;
import org.scholargraph.utils.SqlText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * Columnar store backed by an embedded in-memory DuckDB instance reading Parquet files.
 * <p>
 * One DuckDB database is opened per store. Every call runs on its own duplicated connection,
 * so temporary id tables are private to the call while the memory limit and the worker-thread
 * count, both database-wide settings, bound all concurrent callers together.
 * <p>
 * Configuration:
 * <pre>
 * store {
 *   dataDirectory = "${user.home}/scholargraph/data"
 *   memoryLimit = "8GB"
 *   threads = 4
 *   preserveInsertionOrder = false
 *   tables {
 *     papers = "sciscinet_papers.parquet"
 *     references = "sciscinet_paperrefs.parquet"
 *   }
 * }
 * </pre>
 */
public class DuckDbColumnarStore extends AbstractResource implements IColumnarStore, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DuckDbColumnarStore.class);
    private static final Pattern MEMORY_LIMIT = Pattern.compile("\\d+(\\.\\d+)?\\s*(K|M|G|T)i?B", Pattern.CASE_INSENSITIVE);
    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final int INSERT_BATCH_SIZE = 1000;

    private final Path dataDirectory;
    private final Map<CorpusTable, Path> tableFiles = new EnumMap<>(CorpusTable.class);
    private final String memoryLimit;
    private final int threads;
    private final DuckDBConnection rootConnection;

    private final AtomicLong queriesExecuted = new AtomicLong(0);
    private final AtomicLong queryErrors = new AtomicLong(0);
    private final AtomicLong rowsReturned = new AtomicLong(0);
    private final AtomicLong filesWritten = new AtomicLong(0);

    public DuckDbColumnarStore(String name, Config options) {
        super(name, options);
        if (!options.hasPath("dataDirectory")) {
            throw new IllegalArgumentException("dataDirectory is required for DuckDbColumnarStore '" + name + "'");
        }
        this.dataDirectory = PathExpansion.expandAbsolute(options.getString("dataDirectory"), "dataDirectory");

        for (CorpusTable table : CorpusTable.values()) {
            String key = "tables." + table.configKey();
            String fileName = options.hasPath(key) ? options.getString(key) : table.defaultFileName();
            tableFiles.put(table, dataDirectory.resolve(fileName));
        }

        this.memoryLimit = options.hasPath("memoryLimit") ? options.getString("memoryLimit") : "8GB";
        if (!MEMORY_LIMIT.matcher(memoryLimit).matches()) {
            throw new IllegalArgumentException("memoryLimit must look like '8GB' or '512MiB', got: " + memoryLimit);
        }
        this.threads = options.hasPath("threads") ? options.getInt("threads") : 4;
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be positive, got: " + threads);
        }
        boolean preserveInsertionOrder = options.hasPath("preserveInsertionOrder")
            && options.getBoolean("preserveInsertionOrder");

        try {
            // Load driver explicitly to ensure it's registered
            Class.forName("org.duckdb.DuckDBDriver");
            this.rootConnection = (DuckDBConnection) DriverManager.getConnection("jdbc:duckdb:");
            try (Statement stmt = rootConnection.createStatement()) {
                stmt.execute("SET memory_limit=" + SqlText.quote(memoryLimit));
                stmt.execute("SET threads=" + threads);
                stmt.execute("SET preserve_insertion_order=" + preserveInsertionOrder);
            }
        } catch (ClassNotFoundException | SQLException e) {
            String errorMsg = String.format("Failed to initialize DuckDB store '%s': %s", name, e.getMessage());
            log.error(errorMsg);
            throw new IllegalStateException(errorMsg, e);
        }

        log.debug("DuckDB store '{}' opened on {} (memoryLimit={}, threads={})",
            name, dataDirectory, memoryLimit, threads);
    }

    public Path getDataDirectory() {
        return dataDirectory;
    }

    /**
     * @param table The corpus table.
     * @return The configured Parquet file of the table, whether or not it exists.
     */
    public Path tableFile(CorpusTable table) {
        return tableFiles.get(table);
    }

    @Override
    public String tableSource(CorpusTable table) throws StoreUnavailableException {
        Path file = tableFiles.get(table);
        if (!Files.isReadable(file)) {
            throw new StoreUnavailableException(
                "Backing file for table '" + table.configKey() + "' is missing or unreadable: " + file, file);
        }
        return "read_parquet(" + SqlText.quotePath(file) + ")";
    }

    @Override
    public boolean hasTable(CorpusTable table) {
        return Files.isReadable(tableFiles.get(table));
    }

    @Override
    public QueryResult run(String sql) throws StoreException {
        return run(sql, Collections.emptyMap());
    }

    @Override
    public QueryResult run(String sql, Map<String, ? extends Collection<String>> idTables) throws StoreException {
        long start = System.nanoTime();
        try (Connection conn = rootConnection.duplicate()) {
            registerIdTables(conn, idTables);
            try (Statement stmt = conn.createStatement();
                 ResultSet rs = stmt.executeQuery(sql)) {
                QueryResult result = materialize(rs);
                queriesExecuted.incrementAndGet();
                rowsReturned.addAndGet(result.rowCount());
                if (log.isDebugEnabled()) {
                    log.debug("Query returned {} rows in {} ms: {}",
                        result.rowCount(), (System.nanoTime() - start) / 1_000_000, compact(sql));
                }
                return result;
            }
        } catch (SQLException e) {
            throw failed(sql, e);
        }
    }

    @Override
    public void copyToParquet(String sql, Map<String, ? extends Collection<String>> idTables, Path target)
            throws StoreException {
        String copySql = "COPY (" + sql + ") TO " + SqlText.quotePath(target) + " (FORMAT PARQUET, COMPRESSION 'zstd')";
        try (Connection conn = rootConnection.duplicate()) {
            createParentDirectories(target);
            registerIdTables(conn, idTables);
            try (Statement stmt = conn.createStatement()) {
                stmt.execute(copySql);
            }
            queriesExecuted.incrementAndGet();
            filesWritten.incrementAndGet();
            log.debug("Copied query result to {}", target);
        } catch (SQLException | IOException e) {
            throw failed(copySql, e);
        }
    }

    @Override
    public void writeParquet(QueryResult result, Path target) throws StoreException {
        if (result.columns().isEmpty()) {
            throw new IllegalArgumentException("Cannot write a result without columns to " + target);
        }
        String table = "rows_" + Long.toHexString(System.nanoTime());
        String copySql = "COPY " + table + " TO " + SqlText.quotePath(target) + " (FORMAT PARQUET, COMPRESSION 'zstd')";
        try (Connection conn = rootConnection.duplicate()) {
            createParentDirectories(target);
            createTempTable(conn, table, result);
            insertRows(conn, table, result);
            try (Statement stmt = conn.createStatement()) {
                stmt.execute(copySql);
            }
            queriesExecuted.incrementAndGet();
            filesWritten.incrementAndGet();
            log.debug("Wrote {} rows to {}", result.rowCount(), target);
        } catch (SQLException | IOException e) {
            throw failed(copySql, e);
        }
    }

    @Override
    public QueryResult readParquet(Path file) throws StoreException {
        if (!Files.isReadable(file)) {
            throw new StoreUnavailableException("Parquet file is missing or unreadable: " + file, file);
        }
        return run("SELECT * FROM read_parquet(" + SqlText.quotePath(file) + ")");
    }

    /**
     * Closes the DuckDB instance. Running calls on duplicated connections fail afterwards.
     */
    @Override
    public void close() {
        try {
            rootConnection.close();
            log.debug("DuckDB store '{}' closed", resourceName);
        } catch (SQLException e) {
            log.warn("Failed to close DuckDB store '{}': {}", resourceName, e.getMessage());
            recordError("CLOSE_FAILED", "Failed to close DuckDB connection", "Store: " + resourceName);
        }
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("queries_executed", queriesExecuted.get());
        metrics.put("query_errors", queryErrors.get());
        metrics.put("rows_returned", rowsReturned.get());
        metrics.put("files_written", filesWritten.get());
    }

    private QueryExecutionException failed(String sql, Exception e) {
        queryErrors.incrementAndGet();
        log.debug("Query failed: {}", compact(sql), e);
        return new QueryExecutionException("Query execution failed: " + e.getMessage(), sql, e);
    }

    private void registerIdTables(Connection conn, Map<String, ? extends Collection<String>> idTables)
            throws SQLException {
        for (Map.Entry<String, ? extends Collection<String>> entry : idTables.entrySet()) {
            String name = entry.getKey();
            if (!TABLE_NAME.matcher(name).matches()) {
                throw new IllegalArgumentException("Invalid id table name: " + name);
            }
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("CREATE TEMP TABLE " + name + " (id VARCHAR)");
            }
            insertIds(conn, name, entry.getValue());
        }
    }

    private void insertIds(Connection conn, String table, Collection<String> ids) throws SQLException {
        Iterator<String> it = ids.iterator();
        List<String> batch = new ArrayList<>(INSERT_BATCH_SIZE);
        while (it.hasNext()) {
            batch.add(it.next());
            if (batch.size() == INSERT_BATCH_SIZE || !it.hasNext()) {
                String sql = "INSERT INTO " + table + " VALUES " + String.join(", ", Collections.nCopies(batch.size(), "(?)"));
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    for (int i = 0; i < batch.size(); i++) {
                        ps.setString(i + 1, batch.get(i));
                    }
                    ps.executeUpdate();
                }
                batch.clear();
            }
        }
    }

    private void createTempTable(Connection conn, String table, QueryResult result) throws SQLException {
        List<String> definitions = new ArrayList<>();
        for (String column : result.columns()) {
            definitions.add(SqlText.quoteIdentifier(column) + " " + sqlType(result, column));
        }
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE TEMP TABLE " + table + " (" + String.join(", ", definitions) + ")");
        }
    }

    private void insertRows(Connection conn, String table, QueryResult result) throws SQLException {
        List<String> columns = result.columns();
        List<String> types = new ArrayList<>(columns.size());
        for (String column : columns) {
            types.add(sqlType(result, column));
        }
        String tuple = "(" + String.join(", ", Collections.nCopies(columns.size(), "?")) + ")";
        List<Row> rows = result.rows();
        for (int from = 0; from < rows.size(); from += INSERT_BATCH_SIZE) {
            List<Row> batch = rows.subList(from, Math.min(rows.size(), from + INSERT_BATCH_SIZE));
            String sql = "INSERT INTO " + table + " VALUES " + String.join(", ", Collections.nCopies(batch.size(), tuple));
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                int index = 1;
                for (Row row : batch) {
                    for (int c = 0; c < columns.size(); c++) {
                        Object value = row.get(columns.get(c));
                        if (value == null) {
                            ps.setNull(index++, Types.NULL);
                        } else if ("VARCHAR".equals(types.get(c))) {
                            ps.setString(index++, value.toString());
                        } else {
                            ps.setObject(index++, value);
                        }
                    }
                }
                ps.executeUpdate();
            }
        }
    }

    private static String sqlType(QueryResult result, String column) {
        for (Row row : result.rows()) {
            Object value = row.get(column);
            if (value == null) {
                continue;
            }
            if (value instanceof Integer || value instanceof Short || value instanceof Byte) return "INTEGER";
            if (value instanceof Long) return "BIGINT";
            if (value instanceof Boolean) return "BOOLEAN";
            if (value instanceof Double || value instanceof Float) return "DOUBLE";
            return "VARCHAR";
        }
        return "VARCHAR";
    }

    private static QueryResult materialize(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int columnCount = meta.getColumnCount();
        List<String> columns = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            columns.add(meta.getColumnLabel(i));
        }
        List<Row> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> values = new LinkedHashMap<>();
            for (int i = 1; i <= columnCount; i++) {
                values.put(columns.get(i - 1), normalize(rs.getObject(i)));
            }
            rows.add(new Row(values));
        }
        return new QueryResult(columns, rows);
    }

    /**
     * HUGEINT and DECIMAL aggregates come back as BigInteger/BigDecimal; callers work with long/double.
     */
    private static Object normalize(Object value) {
        if (value instanceof BigInteger big) {
            return big.bitLength() < 64 ? (Object) big.longValue() : big.doubleValue();
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.doubleValue();
        }
        return value;
    }

    private static void createParentDirectories(Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    private static String compact(String sql) {
        return sql.replaceAll("\\s+", " ").trim();
    }
}
