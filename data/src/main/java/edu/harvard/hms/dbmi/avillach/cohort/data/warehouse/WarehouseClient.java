package edu.harvard.hms.dbmi.avillach.cohort.data.warehouse;

import edu.harvard.hms.dbmi.avillach.cohort.data.table.Table;

import java.util.Set;

/**
 * Boundary to the clinical warehouse. Implementations own the connection, paging of large results and retries of transient
 * failures; they only surface final failures.
 */
public interface WarehouseClient {

    /**
     * @param limit maximum number of identifiers to return, or null for all of them
     * @return the distinct identifiers matched by the query, never null
     */
    Set<String> resolveIdentifierQuery(QueryDescription query, Integer limit);

    /**
     * @param includeIdentifiers when not null, only rows whose identifier is in this set are returned
     * @param limit maximum number of rows to return, or null for all of them
     * @return the projected rows, one column per {@link QueryDescription#outputColumns()} name, never null. Where several projected
     * columns share an output name the column holds the first non-null value among them.
     */
    Table resolveDataQuery(QueryDescription query, Set<String> includeIdentifiers, Integer limit);
}
