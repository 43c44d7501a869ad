package com.tablesmith.core.migration;

import com.tablesmith.core.schema.SchemaModel;

import java.util.List;

/**
 * Bootstrap generation: turns a whole model into idempotent, guarded creation batches.
 */
public interface SchemaSqlGenerator {
    List<String> generate(SchemaModel model);
}
