package org.scholargraph.api.resources.store;

import org.scholargraph.api.resources.IMonitorable;

import java.nio.file.Path;
import java.util.Collection;
import java.util.Map;

/**
 * Run-query-get-rows access to a directory of columnar corpus files.
 * <p>
 * Calls are synchronous. The engine may spread one query over several worker threads
 * internally, but working memory and parallelism are capped per store instance.
 * <p>
 * <strong>Id tables:</strong> several operations accept {@code idTables}, a map from a table
 * name to a collection of string ids. Each entry is registered for the duration of the call
 * as a temporary table with a single {@code VARCHAR} column named {@code id}, visible only
 * to that call's query. This is how filtered paper-id sets are joined against the corpus.
 * <p>
 * <strong>Thread Safety:</strong> Implementations MUST be thread-safe.
 */
public interface IColumnarStore extends IMonitorable {

    /**
     * Returns a SQL table expression reading the given corpus table, e.g.
     * {@code read_parquet('/data/sciscinet_papers.parquet')}.
     *
     * @param table The corpus table.
     * @return A table expression usable in a FROM or JOIN clause.
     * @throws StoreUnavailableException if the backing file does not exist or is not readable.
     */
    String tableSource(CorpusTable table) throws StoreUnavailableException;

    /**
     * @param table The corpus table.
     * @return true if the backing file of the table exists and is readable.
     */
    boolean hasTable(CorpusTable table);

    /**
     * Executes a query and materializes all rows.
     *
     * @param sql The query text.
     * @return The result rows.
     * @throws QueryExecutionException if the engine rejects or fails the query.
     */
    QueryResult run(String sql) throws StoreException;

    /**
     * Executes a query with temporary id tables registered.
     *
     * @param sql      The query text, which may reference the names in {@code idTables}.
     * @param idTables Temporary single-column tables to register for this call.
     * @return The result rows.
     * @throws QueryExecutionException if the engine rejects or fails the query.
     */
    QueryResult run(String sql, Map<String, ? extends Collection<String>> idTables) throws StoreException;

    /**
     * Streams the result of a query straight into a Parquet file without materializing it.
     *
     * @param sql      The query text.
     * @param idTables Temporary id tables to register for this call.
     * @param target   Destination file; parent directories are created.
     * @throws QueryExecutionException if the query or the write fails.
     */
    void copyToParquet(String sql, Map<String, ? extends Collection<String>> idTables, Path target)
            throws StoreException;

    /**
     * Writes an in-memory result to a Parquet file, preserving column names and value types.
     *
     * @param result The rows to write.
     * @param target Destination file; parent directories are created.
     * @throws QueryExecutionException if the write fails.
     */
    void writeParquet(QueryResult result, Path target) throws StoreException;

    /**
     * Reads a Parquet file completely.
     *
     * @param file The file to read.
     * @return All rows of the file.
     * @throws StoreUnavailableException if the file does not exist.
     * @throws QueryExecutionException   if the file cannot be decoded.
     */
    QueryResult readParquet(Path file) throws StoreException;
}
