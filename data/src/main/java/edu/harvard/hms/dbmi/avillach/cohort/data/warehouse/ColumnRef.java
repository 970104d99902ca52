package edu.harvard.hms.dbmi.avillach.cohort.data.warehouse;

import java.util.List;
import java.util.Locale;

public record ColumnRef(Relation relation, String name) {

    public ColumnRef {
        if (relation == null || name == null) {
            throw new IllegalArgumentException("A column needs both a relation and a name");
        }
    }

    public String qualifiedName() {
        return relation.name() + "." + name;
    }

    /**
     * Name of the column in fetched tables. Tables use lower case column names throughout.
     */
    public String outputName() {
        return name.toLowerCase(Locale.ROOT);
    }

    /**
     * Column names of a table fetched with {@code projection}, in projection order. Columns of different relations that share an
     * output name, such as the {@code CONTEXT_NAME} of two dimensions, make up a single column.
     */
    public static List<String> outputNames(List<ColumnRef> projection) {
        return projection.stream().map(ColumnRef::outputName).distinct().toList();
    }

    /**
     * Parses the form produced by {@link #qualifiedName()}, e.g. {@code FACT.AGE_IN_DAYS}.
     */
    public static ColumnRef parse(String qualifiedName) {
        int separator = qualifiedName == null ? -1 : qualifiedName.indexOf('.');
        if (separator <= 0 || separator == qualifiedName.length() - 1) {
            throw new IllegalArgumentException("Not a qualified column name: " + qualifiedName);
        }
        Relation relation = Relation.valueOf(qualifiedName.substring(0, separator).toUpperCase(Locale.ROOT));
        return relation.column(qualifiedName.substring(separator + 1).toUpperCase(Locale.ROOT));
    }

    @Override
    public String toString() {
        return qualifiedName();
    }
}
