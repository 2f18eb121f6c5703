package com.pyflow.model.settings;

import com.pyflow.model.DatasetRole;
import com.pyflow.model.RecipeType;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JoinTypeTest {

    @Test
    void looseNamesMapToJoinTypes() {
        assertEquals(JoinType.LEFT, JoinType.fromValue("left_outer"));
        assertEquals(JoinType.OUTER, JoinType.fromValue(" FULL "));
        assertEquals(JoinType.INNER, JoinType.fromValue("inner"));
        assertEquals(JoinType.INNER, JoinType.fromValue(null));
        assertTrue(JoinType.isRecognized(null));
        assertTrue(JoinType.isRecognized("cross"));
    }

    @Test
    void unknownValueFallsBackButIsNotRecognized() {
        assertEquals(JoinType.INNER, JoinType.fromValue("banana"));
        assertFalse(JoinType.isRecognized("banana"));
    }

    @Test
    void parsingIgnoresTheDefaultLocale() {
        Locale saved = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertEquals(JoinType.INNER, JoinType.fromValue("INNER"));
            assertTrue(JoinType.isRecognized("INNER"));
            assertEquals(DatasetRole.INPUT, DatasetRole.fromValue("INPUT"));
            assertEquals(RecipeType.DISTINCT, RecipeType.fromValue("DISTINCT"));
        } finally {
            Locale.setDefault(saved);
        }
    }
}
