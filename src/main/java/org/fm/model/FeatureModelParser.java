package org.fm.model;

import org.fm.constraint.ConstraintParser;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * PARSER FEATURE MODEL XML - Costruzione dell'albero tipizzato dal documento
 *
 * FORMATO ACCETTATO:
 * - elemento radice con qualunque nome; il primo figlio diretto {@code feature} è la radice
 * - {@code feature}: attributi {@code name} (obbligatorio) e {@code mandatory} (default false)
 * - figli: un solo elemento {@code group type="xor|or|and"} oppure feature dirette
 * - {@code constraint}, in qualunque punto: {@code englishStatement} e, opzionale,
 *   {@code translation} con la forma formale del vincolo
 *
 * GESTIONE ERRORI:
 * Ogni anomalia strutturale produce {@link ModelParseException} con causa leggibile;
 * l'albero viene costruito solo a parsing completato, quindi nessuno stato parziale
 * sopravvive a un fallimento. Le dichiarazioni DOCTYPE sono rifiutate.
 */
public class FeatureModelParser {

    private static final Logger LOGGER = Logger.getLogger(FeatureModelParser.class.getName());

    private static final String FEATURE_TAG = "feature";
    private static final String GROUP_TAG = "group";
    private static final String CONSTRAINT_TAG = "constraint";
    private static final String ENGLISH_TAG = "englishStatement";
    private static final String TRANSLATION_TAG = "translation";
    private static final String XML_EXTENSION = ".xml";

    private final ConstraintParser constraintParser;

    public FeatureModelParser() {
        this(new ConstraintParser());
    }

    public FeatureModelParser(ConstraintParser constraintParser) {
        if (constraintParser == null) {
            throw new IllegalArgumentException("ConstraintParser non può essere null");
        }
        this.constraintParser = constraintParser;
    }

    //region PUNTI DI INGRESSO

    /**
     * Carica un modello da file; accetta solo file con estensione .xml.
     *
     * @param path percorso del documento
     * @return modello immutabile
     * @throws ModelParseException se il file non è leggibile, non è XML o è malformato
     */
    public FeatureModel parse(Path path) {
        if (path == null) {
            throw new IllegalArgumentException("Percorso del modello non può essere null");
        }
        String fileName = path.getFileName().toString();
        if (!fileName.toLowerCase(Locale.ROOT).endsWith(XML_EXTENSION)) {
            throw new ModelParseException("Tipo di file non valido (atteso .xml): " + fileName);
        }
        if (!Files.isRegularFile(path)) {
            throw new ModelParseException("File del modello inesistente: " + path);
        }

        LOGGER.info("Caricamento feature model da " + path);
        try (InputStream input = Files.newInputStream(path)) {
            return parse(input);
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, "Errore di lettura del modello " + path, e);
            throw new ModelParseException("Impossibile leggere il modello " + fileName + ": " + e.getMessage(), e);
        }
    }

    /**
     * @param input flusso del documento XML (non chiuso da questo metodo)
     * @return modello immutabile
     */
    public FeatureModel parse(InputStream input) {
        if (input == null) {
            throw new IllegalArgumentException("Input del modello non può essere null");
        }
        return buildModel(readDocument(new InputSource(input)));
    }

    /**
     * @param xml contenuto del documento
     * @return modello immutabile
     */
    public FeatureModel parseString(String xml) {
        if (xml == null || xml.isBlank()) {
            throw new ModelParseException("Documento del modello vuoto");
        }
        return buildModel(readDocument(new InputSource(new StringReader(xml))));
    }

    //endregion

    //region LETTURA DOCUMENTO

    private Document readDocument(InputSource source) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);

            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new FailingErrorHandler());
            return builder.parse(source);

        } catch (SAXException e) {
            throw new ModelParseException("Documento XML malformato: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ModelParseException("Impossibile leggere il documento: " + e.getMessage(), e);
        } catch (ParserConfigurationException e) {
            LOGGER.log(Level.SEVERE, "Configurazione parser XML non supportata", e);
            throw new IllegalStateException("Parser XML non configurabile", e);
        }
    }

    /**
     * Trasforma warning ed errori recuperabili in errori fatali, senza stampe su stderr.
     */
    private static final class FailingErrorHandler implements ErrorHandler {
        @Override
        public void warning(SAXParseException exception) {
            LOGGER.fine("Warning XML: " + exception.getMessage());
        }

        @Override
        public void error(SAXParseException exception) throws SAXException {
            throw exception;
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXException {
            throw exception;
        }
    }

    //endregion

    //region COSTRUZIONE ALBERO

    private FeatureModel buildModel(Document document) {
        Element documentElement = document.getDocumentElement();
        Element rootElement = FEATURE_TAG.equals(documentElement.getTagName())
                ? documentElement
                : firstChildElement(documentElement, FEATURE_TAG);
        if (rootElement == null) {
            throw new ModelParseException("Nessuna feature radice nel documento <" + documentElement.getTagName() + ">");
        }

        Set<String> names = new LinkedHashSet<>();
        Feature root = parseFeature(rootElement, null, names);
        List<CrossTreeConstraint> constraints = parseConstraints(document, Collections.unmodifiableSet(names));

        FeatureModel model = new FeatureModel(root, constraints);
        LOGGER.info(String.format("Feature model caricato: radice=%s, %d feature, %d vincoli (%d non supportati)",
                root.getName(), model.size(), constraints.size(), model.getUnsupportedConstraints().size()));
        return model;
    }

    /**
     * Parsing ricorsivo di una feature: i figli sono costruiti prima del padre, che
     * ne acquisisce il possesso.
     */
    private Feature parseFeature(Element element, String parentName, Set<String> names) {
        String name = element.getAttribute("name").trim();
        if (name.isEmpty()) {
            String location = parentName == null ? "radice" : "figlia di " + parentName;
            throw new ModelParseException("Attributo name mancante per la feature " + location);
        }
        if (!names.add(name)) {
            throw new ModelParseException("Nome di feature duplicato: " + name);
        }

        boolean mandatory = "true".equalsIgnoreCase(element.getAttribute("mandatory").trim());

        List<Element> groups = childElements(element, GROUP_TAG);
        List<Element> directFeatures = childElements(element, FEATURE_TAG);

        if (groups.size() > 1) {
            throw new ModelParseException("La feature " + name + " dichiara più di un gruppo");
        }
        if (!groups.isEmpty() && !directFeatures.isEmpty()) {
            throw new ModelParseException("La feature " + name + " dichiara sia un gruppo sia figli diretti");
        }

        GroupType groupType = GroupType.NONE;
        List<Element> childElements = directFeatures;

        if (!groups.isEmpty()) {
            Element group = groups.get(0);
            groupType = parseGroupType(group, name);
            childElements = groupMembers(group, name);

            if (groupType != GroupType.NONE && childElements.isEmpty()) {
                throw new ModelParseException("Gruppo " + groupType + " vuoto per la feature " + name);
            }
        }

        List<Feature> children = new ArrayList<>(childElements.size());
        for (Element childElement : childElements) {
            children.add(parseFeature(childElement, name, names));
        }

        LOGGER.finest("Feature letta: " + name + " (figli=" + children.size() + ", gruppo=" + groupType + ")");
        return new Feature(name, mandatory, parentName, children, groupType);
    }

    private GroupType parseGroupType(Element group, String featureName) {
        if (!group.hasAttribute("type")) {
            throw new ModelParseException("Gruppo senza attributo type nella feature " + featureName);
        }
        try {
            return GroupType.fromAttribute(group.getAttribute("type"));
        } catch (IllegalArgumentException e) {
            throw new ModelParseException(e.getMessage() + " (feature " + featureName + ")", e);
        }
    }

    /**
     * Ogni elemento di un gruppo deve essere una feature.
     */
    private List<Element> groupMembers(Element group, String featureName) {
        List<Element> members = childElements(group, null);
        for (Element member : members) {
            if (!FEATURE_TAG.equals(member.getTagName())) {
                throw new ModelParseException("Elemento <" + member.getTagName() +
                        "> non ammesso nel gruppo della feature " + featureName);
            }
        }
        return members;
    }

    //endregion

    //region VINCOLI CROSS-TREE

    private List<CrossTreeConstraint> parseConstraints(Document document, Set<String> knownFeatures) {
        List<CrossTreeConstraint> constraints = new ArrayList<>();
        NodeList nodes = document.getElementsByTagName(CONSTRAINT_TAG);

        for (int i = 0; i < nodes.getLength(); i++) {
            Element constraintElement = (Element) nodes.item(i);

            Element english = firstChildElement(constraintElement, ENGLISH_TAG);
            if (english == null) {
                throw new ModelParseException("Vincolo #" + (i + 1) + " senza englishStatement");
            }
            Element translation = firstChildElement(constraintElement, TRANSLATION_TAG);

            String englishText = english.getTextContent().trim();
            String translationText = translation == null ? null : translation.getTextContent().trim();

            constraints.add(constraintParser.parse(englishText, translationText, knownFeatures));
        }

        return constraints;
    }

    //endregion

    //region UTILITÀ DOM

    /**
     * @param tagName filtro sul nome, null per tutti gli elementi
     * @return figli diretti di tipo elemento, in ordine di documento
     */
    private static List<Element> childElements(Element parent, String tagName) {
        List<Element> result = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE
                    && (tagName == null || tagName.equals(((Element) node).getTagName()))) {
                result.add((Element) node);
            }
        }
        return result;
    }

    private static Element firstChildElement(Element parent, String tagName) {
        List<Element> matches = childElements(parent, tagName);
        return matches.isEmpty() ? null : matches.get(0);
    }

    //endregion
}
