package com.testplatform.request;

import com.testplatform.exception.SettingsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;

/**
 * Reads and completes run settings XML:
 * <pre>
 * &lt;RunSettings&gt;
 *   &lt;RunConfiguration&gt;
 *     &lt;BatchSize&gt;15&lt;/BatchSize&gt;
 *     &lt;DesignMode&gt;True&lt;/DesignMode&gt;
 *     &lt;CollectSourceInformation&gt;True&lt;/CollectSourceInformation&gt;
 *   &lt;/RunConfiguration&gt;
 * &lt;/RunSettings&gt;
 * </pre>
 * Values set by the user always win over runner defaults; unknown elements pass through.
 */
public final class RunSettingsUtilities {

    private static final Logger log = LoggerFactory.getLogger(RunSettingsUtilities.class);

    public static final String RUN_SETTINGS = "RunSettings";
    public static final String RUN_CONFIGURATION = "RunConfiguration";
    public static final String BATCH_SIZE = "BatchSize";
    public static final String DESIGN_MODE = "DesignMode";
    public static final String COLLECT_SOURCE_INFORMATION = "CollectSourceInformation";

    public static final int DEFAULT_BATCH_SIZE = 10;

    public static final String EMPTY_RUN_SETTINGS =
            "<RunSettings><RunConfiguration></RunConfiguration></RunSettings>";

    private RunSettingsUtilities() {
    }

    /**
     * Run settings after runner defaults have been applied.
     *
     * @param runSettings Settings XML to hand to the engine
     * @param batchSize   Number of tests or results per event
     */
    public record MergedRunSettings(String runSettings, int batchSize) {
    }

    /**
     * Apply runner defaults to the user's run settings.
     * {@code DesignMode} and {@code CollectSourceInformation} are added with the runner's
     * design mode unless the user already set them.
     *
     * @param runSettings Run settings XML from the request, may be null or blank
     * @param designMode  Runner design mode
     * @return Merged settings
     * @throws SettingsException if the XML is invalid or a value is unsupported
     */
    public static MergedRunSettings merge(String runSettings, boolean designMode) {
        String source = runSettings == null || runSettings.isBlank() ? EMPTY_RUN_SETTINGS : runSettings;
        Document document = parse(source);

        int batchSize = getBatchSize(document);

        String flag = formatBoolean(designMode);
        boolean updated = addRunConfigurationValueIfMissing(document, DESIGN_MODE, flag);
        updated |= addRunConfigurationValueIfMissing(document, COLLECT_SOURCE_INFORMATION, flag);

        String merged = updated ? toXml(document) : source;
        log.debug("Merged run settings (batchSize={}, updated={}): {}", batchSize, updated, merged);
        return new MergedRunSettings(merged, batchSize);
    }

    /**
     * Parse run settings XML. The root element must be {@code RunSettings}.
     */
    public static Document parse(String runSettings) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new DefaultHandler());
            Document document = builder.parse(new InputSource(new StringReader(runSettings.trim())));

            Element root = document.getDocumentElement();
            if (!RUN_SETTINGS.equals(root.getNodeName())) {
                throw new SettingsException("Invalid run settings: root element must be <"
                        + RUN_SETTINGS + "> but was <" + root.getNodeName() + ">");
            }
            return document;
        } catch (SAXException | IOException e) {
            throw new SettingsException("Invalid run settings XML: " + e.getMessage(), e);
        } catch (ParserConfigurationException e) {
            throw new SettingsException("XML parser is not available", e);
        }
    }

    /**
     * Read {@code RunConfiguration/BatchSize}, or {@link #DEFAULT_BATCH_SIZE} when absent.
     */
    public static int getBatchSize(Document document) {
        Element runConfiguration = findChild(document.getDocumentElement(), RUN_CONFIGURATION);
        Element batchSize = runConfiguration == null ? null : findChild(runConfiguration, BATCH_SIZE);
        if (batchSize == null) {
            return DEFAULT_BATCH_SIZE;
        }

        String text = batchSize.getTextContent().trim();
        try {
            int value = Integer.parseInt(text);
            if (value <= 0) {
                throw new SettingsException("Invalid value '" + text + "' for " + BATCH_SIZE
                        + ": must be a positive integer");
            }
            return value;
        } catch (NumberFormatException e) {
            throw new SettingsException("Invalid value '" + text + "' for " + BATCH_SIZE
                    + ": must be a positive integer", e);
        }
    }

    /**
     * Add {@code RunConfiguration/<name>} unless present. {@code RunConfiguration} is created when missing.
     *
     * @return true if the document was changed
     */
    public static boolean addRunConfigurationValueIfMissing(Document document, String name, String value) {
        Element root = document.getDocumentElement();
        Element runConfiguration = findChild(root, RUN_CONFIGURATION);
        if (runConfiguration == null) {
            runConfiguration = document.createElement(RUN_CONFIGURATION);
            root.appendChild(runConfiguration);
        } else if (findChild(runConfiguration, name) != null) {
            return false;
        }

        Element element = document.createElement(name);
        element.setTextContent(value);
        runConfiguration.appendChild(element);
        return true;
    }

    /**
     * Serialize without an XML declaration.
     */
    public static String toXml(Document document) {
        try {
            Transformer transformer = TransformerFactory.newInstance().newTransformer();
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
            StringWriter writer = new StringWriter();
            transformer.transform(new DOMSource(document), new StreamResult(writer));
            return writer.toString();
        } catch (TransformerException e) {
            throw new SettingsException("Failed to write run settings: " + e.getMessage(), e);
        }
    }

    public static String formatBoolean(boolean value) {
        return value ? "True" : "False";
    }

    private static Element findChild(Element parent, String name) {
        for (Node node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (node.getNodeType() == Node.ELEMENT_NODE && name.equals(node.getNodeName())) {
                return (Element) node;
            }
        }
        return null;
    }
}
