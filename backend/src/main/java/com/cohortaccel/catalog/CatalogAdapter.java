package com.cohortaccel.catalog;

/**
 * Source of the schema catalog. Called before the first compilation of a
 * session and again whenever a repair needs a fresh view of the data store.
 */
public interface CatalogAdapter {

    CatalogSchema getSchema();
}
