package com.whereq.cascade.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;

/**
 * One output unit (a study) from the job specification, with its merged item selection
 */
@Value
@Builder(toBuilder = true)
public class BatchUnit {
    public static final String ALL_ITEMS = "all";

    /**
     * Output directory name under the base path
     */
    String name;

    /**
     * Source accession (GSE, SRP, ...) the items belong to
     */
    String sourceAccession;

    /**
     * Explicit allow-list; ignored when {@link #allItems} is set
     */
    @Singular
    List<String> items;

    /**
     * Discover every item available for the unit at run time
     */
    boolean allItems;

    /**
     * Optional credential file for controlled-access data
     */
    Path authFile;

    public boolean selects(String itemId) {
        return allItems || items.contains(itemId);
    }

    public static BatchUnit all(String name) {
        return BatchUnit.builder().name(name).allItems(true).build();
    }
}
