package com.lvfield.equiptrack.model;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InstallSide Tests")
class InstallSideTest {

    private final Locale original = Locale.getDefault();

    @AfterEach
    void restoreLocale() {
        Locale.setDefault(original);
    }

    @Test
    @DisplayName("Codes are parsed regardless of case, dashes and spaces")
    void testFromCode_Normalizes() {
        assertEquals(InstallSide.HEAD_END, InstallSide.fromCode(" Head-End "));
        assertEquals(InstallSide.ROOM_END, InstallSide.fromCode("room end"));
        assertEquals(InstallSide.UNSPECIFIED, InstallSide.fromCode(null));
        assertEquals(InstallSide.UNSPECIFIED, InstallSide.fromCode("rack"));
    }

    @Test
    @DisplayName("Upper-case codes parse the same under a Turkish default locale")
    void testFromCode_TurkishLocale() {
        Locale.setDefault(new Locale("tr", "TR"));

        assertEquals(InstallSide.UNSPECIFIED, InstallSide.fromCode("UNSPECIFIED"));
        assertEquals(InstallSide.HEAD_END, InstallSide.fromCode("HEAD_END"));
        assertEquals(InstallSide.ROOM_END, InstallSide.fromCode("ROOM_END"));
    }
}
