package org.fm;

import org.fm.model.FeatureModel;
import org.fm.model.FeatureModelParser;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Modelli di prova caricati da src/test/resources/models.
 */
public final class TestModels {

    /** Root → A (obbligatoria, XOR{B, C}) */
    public static final String XOR_MANDATORY = "xor-mandatory.xml";

    /** Search XOR, Location opzionale, Payment OR, ByLocation requires Location */
    public static final String SEARCH_APP = "search-app.xml";

    /** Un vincolo non riconosciuto e un Excludes */
    public static final String UNSUPPORTED_CONSTRAINT = "unsupported-constraint.xml";

    /** Cinque figlie opzionali indipendenti */
    public static final String INDEPENDENT_OPTIONS = "independent-options.xml";

    /** Radice con sei alternative XOR: sei prodotti minimi */
    public static final String WIDE_XOR = "wide-xor.xml";

    /** P opzionale con figlia obbligatoria F, Q opzionale */
    public static final String NESTED_MANDATORY = "nested-mandatory.xml";

    /** A e B obbligatorie ma mutuamente esclusive */
    public static final String UNSATISFIABLE = "unsatisfiable.xml";

    private TestModels() {}

    public static FeatureModel load(String name) {
        try (InputStream input = TestModels.class.getResourceAsStream("/models/" + name)) {
            if (input == null) {
                throw new IllegalArgumentException("Modello di prova inesistente: " + name);
            }
            return new FeatureModelParser().parse(input);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static Path path(String name) {
        try {
            return Paths.get(TestModels.class.getResource("/models/" + name).toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }
}
