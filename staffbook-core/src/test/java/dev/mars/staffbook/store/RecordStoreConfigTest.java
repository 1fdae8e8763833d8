/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.staffbook.store;

import dev.mars.staffbook.store.RecordStoreConfig.Setting;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link RecordStoreConfig} resolution and value parsing.
 */
class RecordStoreConfigTest {

    private static final long MB = 1024L * 1024;

    @BeforeEach
    void setUp() {
        clearSystemProperties();
    }

    @AfterEach
    void tearDown() {
        clearSystemProperties();
    }

    private static void clearSystemProperties() {
        for (Setting setting : Setting.values()) {
            System.clearProperty(setting.propertyKey());
        }
    }

    @Test
    void testDefaults() {
        RecordStoreConfig config = RecordStoreConfig.load();

        assertTrue(config.syncEnabled());
        assertFalse(config.verifyWrites());
        assertEquals(64 * MB, config.minFreeSpace());
        assertEquals(64 * MB, config.maxCollectionSize());
        assertTrue(config.dataDir().endsWith(Path.of(".staffbook", "data")));
    }

    @Test
    void testSettingKeys() {
        assertEquals("staffbook.maxCollectionSize", Setting.MAX_COLLECTION_SIZE.propertyKey());
        assertEquals("STAFFBOOK_MAX_COLLECTION_SIZE", Setting.MAX_COLLECTION_SIZE.environmentVariable());
        assertEquals("staffbook.dataDir", Setting.DATA_DIR.propertyKey());
        assertEquals("STAFFBOOK_DATA_DIR", Setting.DATA_DIR.environmentVariable());
    }

    @Test
    void testSystemPropertyOverridesDefault() {
        System.setProperty("staffbook.dataDir", "/tmp/staffbook-sysprop");
        System.setProperty("staffbook.verifyWrites", "TRUE");
        System.setProperty("staffbook.maxCollectionSize", " 8MB ");

        RecordStoreConfig config = RecordStoreConfig.load();

        assertEquals(Path.of("/tmp/staffbook-sysprop"), config.dataDir());
        assertTrue(config.verifyWrites());
        assertEquals(8 * MB, config.maxCollectionSize());
    }

    @Test
    void testBuilderOverridesSystemProperty() {
        System.setProperty("staffbook.syncEnabled", "true");
        System.setProperty("staffbook.minFreeSpace", "lots");

        RecordStoreConfig config = RecordStoreConfig.builder()
                .syncEnabled(false)
                .minFreeSpace(2048)
                .build();

        assertFalse(config.syncEnabled());
        assertEquals(2048, config.minFreeSpace());
    }

    @Test
    void testBlankValueIgnored() {
        System.setProperty("staffbook.maxCollectionSize", "   ");

        assertEquals(64 * MB, RecordStoreConfig.load().maxCollectionSize());
    }

    @Test
    void testMalformedSizeRejected() {
        System.setProperty("staffbook.minFreeSpace", "lots");

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, RecordStoreConfig::load);
        assertTrue(ex.getMessage().startsWith("staffbook.minFreeSpace"));
    }

    @Test
    void testMalformedFlagRejected() {
        System.setProperty("staffbook.syncEnabled", "yes");

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, RecordStoreConfig::load);
        assertTrue(ex.getMessage().contains("true or false"));
    }

    @Test
    void testParseSizeUnits() {
        assertEquals(4096, RecordStoreConfig.parseSize("4096"));
        assertEquals(512 * 1024, RecordStoreConfig.parseSize("512KB"));
        assertEquals(64 * MB, RecordStoreConfig.parseSize("64mb"));
        assertEquals(2 * 1024 * MB, RecordStoreConfig.parseSize("2 GB"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "MB", "-1", "1.5MB", "10TB", "99999999999GB"})
    void testParseSizeRejects(String text) {
        assertThrows(IllegalArgumentException.class, () -> RecordStoreConfig.parseSize(text));
    }

    @Test
    void testStringDataDirAndToString() {
        RecordStoreConfig config = RecordStoreConfig.builder()
                .dataDir("build/data")
                .maxCollectionSize(3 * MB)
                .minFreeSpace(1536)
                .build();

        assertEquals(Path.of("build/data"), config.dataDir());
        assertTrue(config.toString().contains("dataDir=build"));
        assertTrue(config.toString().contains("maxCollectionSize=3MB"));
        assertTrue(config.toString().contains("minFreeSpace=1536B"));
    }
}
