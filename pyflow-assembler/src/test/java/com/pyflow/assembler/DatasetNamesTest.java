package com.pyflow.assembler;

import com.pyflow.model.RecipeType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class DatasetNamesTest {

    @Test
    void sanitizeReplacesDisallowedCharacters() {
        assertEquals("monthly_sales", DatasetNames.sanitize("monthly-sales"));
        assertEquals("ds_2024_data", DatasetNames.sanitize("2024 data"));
        assertEquals("quoted", DatasetNames.sanitize("'quoted'"));
        assertEquals("dataset", DatasetNames.sanitize("  "));
        assertEquals("dataset", DatasetNames.sanitize(null));
    }

    @Test
    void fromPathUsesFileNameUpToFirstDot() {
        assertEquals("sales", DatasetNames.fromPath("data/raw/sales.2024.csv"));
        assertEquals("orders", DatasetNames.fromPath("C:\\exports\\orders.parquet"));
        assertEquals("events", DatasetNames.fromPath("s3://bucket/events/"));
        assertEquals("customers", DatasetNames.fromPath("https://example.com/customers.json?token=x"));
        assertNull(DatasetNames.fromPath(".env"));
        assertNull(DatasetNames.fromPath(null));
    }

    @Test
    void recipeNamesShareOneOrdinal() {
        RecipeNamer namer = RecipeNamer.plain();
        assertEquals("prepare_1", namer.next(RecipeType.PREPARE));
        assertEquals("grouping_2", namer.next(RecipeType.GROUPING));
        assertEquals("prepare_3", namer.next(RecipeType.PREPARE));
    }

    @Test
    void reservedRecipeNamesAreSkipped() {
        RecipeNamer namer = new RecipeNamer("etl_", "_v1");
        namer.reserve("etl_sort_1_v1");
        assertEquals("etl_sort_2_v1", namer.next(RecipeType.SORT));
        namer.reset();
        assertEquals("etl_sort_1_v1", namer.next(RecipeType.SORT));
    }
}
