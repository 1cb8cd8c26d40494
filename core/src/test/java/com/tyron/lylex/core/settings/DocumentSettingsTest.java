package com.tyron.lylex.core.settings;

import com.google.common.truth.Truth;
import com.tyron.lylex.testFramework.TestLogging;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Properties;
import java.util.logging.Level;

import static org.junit.jupiter.api.Assertions.*;

public class DocumentSettingsTest {

    private static InputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    public void readsYaml() {
        DocumentSettings settings = DocumentSettings.load(yaml("""
                resyncLineLimit: 40
                mode: Scheme
                """));

        assertEquals(40, settings.getResyncLineLimit());
        assertEquals("scheme", settings.getMode());
    }

    @Test
    public void invalidValuesFallBackToDefaults() {
        try (TestLogging.LogCapture log = TestLogging.capture(DocumentSettings.class, Level.WARNING)) {
            DocumentSettings settings = DocumentSettings.load(yaml("""
                    resyncLineLimit: lots
                    mode: "  "
                    """));

            assertEquals(DocumentSettings.DEFAULT_RESYNC_LINE_LIMIT, settings.getResyncLineLimit());
            assertNull(settings.getMode());

            DocumentSettings negative = DocumentSettings.load(yaml("resyncLineLimit: -3"));
            assertEquals(DocumentSettings.DEFAULT_RESYNC_LINE_LIMIT, negative.getResyncLineLimit());

            assertEquals(List.of(
                    "settings key=resyncLineLimit value=lots ignored reason=notAnInteger",
                    "settings key=resyncLineLimit value=-3 ignored reason=negative"), log.getMessages("settings key="));
        }
    }

    @Test
    public void emptyOrScalarDocumentsAreIgnored() {
        assertEquals(DocumentSettings.DEFAULT_RESYNC_LINE_LIMIT, DocumentSettings.load(yaml("")).getResyncLineLimit());
        assertEquals(DocumentSettings.DEFAULT_RESYNC_LINE_LIMIT, DocumentSettings.load(yaml("just text")).getResyncLineLimit());
    }

    @Test
    public void malformedYamlFails() {
        SettingsException e = assertThrows(SettingsException.class, () -> DocumentSettings.load(yaml("a: [unclosed")));
        Truth.assertThat(e).hasCauseThat().isNotNull();
    }

    @Test
    public void classpathResourceIsRead() {
        Truth.assertThat(DocumentSettings.defaults().getResyncLineLimit()).isEqualTo(500);
        assertEquals(DocumentSettings.DEFAULT_RESYNC_LINE_LIMIT, DocumentSettings.builtIn().getResyncLineLimit());
    }

    @Test
    public void propertiesOverrideFileValues() {
        Properties properties = new Properties();
        properties.setProperty("lylex.resyncLineLimit", "0");
        properties.setProperty("lylex.mode", "text");

        DocumentSettings settings = DocumentSettings.builder()
                .resyncLineLimit(12)
                .applyProperties(properties)
                .build();

        assertEquals(0, settings.getResyncLineLimit());
        assertEquals("text", settings.getMode());
    }

    @Test
    public void builderRejectsNegativeLimit() {
        assertThrows(IllegalArgumentException.class, () -> DocumentSettings.builder().resyncLineLimit(-1));
        DocumentSettings copy = DocumentSettings.builder().resyncLineLimit(7).mode("lilypond").build().toBuilder().build();
        assertEquals(7, copy.getResyncLineLimit());
        assertEquals("lilypond", copy.getMode());
    }
}
