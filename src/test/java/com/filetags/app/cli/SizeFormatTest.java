package com.filetags.app.cli;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SizeFormatTest {

    @Test
    void explorerStyleUnits() {
        assertEquals("0B", SizeFormat.explorer(0));
        assertEquals("512B", SizeFormat.explorer(512));
        assertEquals("1KB", SizeFormat.explorer(1024));
        assertEquals("12KB", SizeFormat.explorer(12 * 1024 + 100));
        assertEquals("1,000KB", SizeFormat.explorer(1000 * 1024));
        assertEquals("1.5MB", SizeFormat.explorer(1536L * 1024));
        assertEquals("2MB", SizeFormat.explorer(2L * 1024 * 1024));
        assertEquals("2GB", SizeFormat.explorer(2L * 1024 * 1024 * 1024));
        assertEquals("3.4GB", SizeFormat.explorer((long) (3.4 * 1024 * 1024 * 1024)));
    }
}
