package org.dxworks.ommlatex.reader;

import org.dxworks.ommlatex.model.MathAttribute;
import org.dxworks.ommlatex.model.MathNode;
import org.dxworks.ommlatex.model.MathNodeKind;
import org.dxworks.ommlatex.model.MathRole;
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
import java.util.ArrayList;
import java.util.List;

/**
 * Reads serialized Office Math (OMML) into {@link MathNode} trees.
 *
 * <p>Every {@code oMath} element found in the document is one expression, wherever it sits
 * (a bare fragment, inside an {@code oMathPara}, or inside a word-processing body). A document
 * without any {@code oMath} whose root is itself an OMML element is read as a single expression.
 * Elements outside the OMML namespace are descended into when looking for expressions but are
 * not part of the tree; unprefixed elements are accepted as OMML.</p>
 */
public class OmmlReader {

    public static final String OMML_NAMESPACE = "http://schemas.openxmlformats.org/officeDocument/2006/math";

    private static final String TEXT_TAG = "t";
    private static final String PROPERTIES_SUFFIX = "Pr";

    /**
     * Reads every expression of a serialized fragment. The parser picks the character encoding
     * from the byte order mark or the XML declaration.
     */
    public List<MathNode> readExpressions(InputStream in) throws OmmlParseException {
        return collectExpressions(parse(new InputSource(in)));
    }

    List<MathNode> readExpressions(String xml) throws OmmlParseException {
        if (xml == null || xml.isBlank()) {
            throw new OmmlParseException("Fragment is empty");
        }
        return collectExpressions(parse(new InputSource(new StringReader(xml))));
    }

    /**
     * Reads the first expression of the fragment.
     */
    MathNode readExpression(String xml) throws OmmlParseException {
        List<MathNode> expressions = readExpressions(xml);
        if (expressions.isEmpty()) {
            throw new OmmlParseException("Fragment contains no math expression");
        }
        return expressions.get(0);
    }

    private List<MathNode> collectExpressions(Document document) {
        Element root = document.getDocumentElement();

        List<Element> mathElements = new ArrayList<>();
        collectMathElements(root, mathElements);

        List<MathNode> expressions = new ArrayList<>();
        if (mathElements.isEmpty()) {
            if (isMathElement(root)) {
                expressions.add(asExpression(readNode(root)));
            }
            return expressions;
        }

        for (Element mathElement : mathElements) {
            expressions.add(readNode(mathElement));
        }
        return expressions;
    }

    private Document parse(InputSource source) throws OmmlParseException {
        try {
            DocumentBuilder builder = newDocumentBuilder();
            return builder.parse(source);
        } catch (SAXException | IOException e) {
            throw new OmmlParseException("Malformed OMML fragment: " + e.getMessage(), e);
        } catch (ParserConfigurationException e) {
            throw new OmmlParseException("XML parser unavailable: " + e.getMessage(), e);
        }
    }

    private static DocumentBuilder newDocumentBuilder() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setXIncludeAware(false);
        factory.setExpandEntityReferences(false);
        DocumentBuilder builder = factory.newDocumentBuilder();
        builder.setErrorHandler(new ErrorHandler() {
            @Override
            public void warning(SAXParseException exception) {
                // warnings do not make a fragment unreadable
            }

            @Override
            public void error(SAXParseException exception) throws SAXException {
                throw exception;
            }

            @Override
            public void fatalError(SAXParseException exception) throws SAXException {
                throw exception;
            }
        });
        return builder;
    }

    private void collectMathElements(Element element, List<Element> sink) {
        if (isMathElement(element) && MathNodeKind.ROOT.getTag().equals(localName(element))) {
            sink.add(element);
            return;
        }
        for (Element child : childElements(element)) {
            collectMathElements(child, sink);
        }
    }

    private MathNode asExpression(MathNode node) {
        if (node.getKind() == MathNodeKind.ROOT) {
            return node;
        }
        return MathNode.builder(MathNodeKind.ROOT).child(node).build();
    }

    private MathNode readNode(Element element) {
        String tag = localName(element);
        MathNodeKind kind = MathNodeKind.fromTag(tag);
        MathNode.Builder builder = MathNode.builder(kind).tag(tag);

        if (kind == MathNodeKind.RUN) {
            return builder.text(collectRunText(element)).build();
        }

        for (Element child : childElements(element)) {
            if (!isMathElement(child)) continue;

            String childTag = localName(child);
            if (childTag.endsWith(PROPERTIES_SUFFIX)) {
                readProperties(kind, child, builder);
                continue;
            }

            MathRole role = MathRole.fromTag(childTag);
            MathNode childNode = readNode(child);
            if (role != null) {
                builder.child(role, childNode);
            } else {
                builder.child(childNode);
            }
        }
        return builder.build();
    }

    private String collectRunText(Element run) {
        StringBuilder text = new StringBuilder();
        NodeList texts = run.getElementsByTagNameNS("*", TEXT_TAG);
        for (int i = 0; i < texts.getLength(); i++) {
            Element t = (Element) texts.item(i);
            if (isMathElement(t)) {
                text.append(t.getTextContent());
            }
        }
        return text.toString();
    }

    private void readProperties(MathNodeKind kind, Element properties, MathNode.Builder builder) {
        for (Element property : childElements(properties)) {
            String value = valueOf(property);
            switch (localName(property)) {
                case "chr":
                    if (kind == MathNodeKind.NARY) {
                        builder.attribute(MathAttribute.OPERATOR_CHAR, value);
                    } else if (kind == MathNodeKind.ACCENT) {
                        builder.attribute(MathAttribute.ACCENT_CHAR, value);
                    }
                    break;
                case "begChr":
                    builder.attribute(MathAttribute.BEGIN_CHAR, value);
                    break;
                case "endChr":
                    builder.attribute(MathAttribute.END_CHAR, value);
                    break;
                case "sepChr":
                    builder.attribute(MathAttribute.SEPARATOR_CHAR, value);
                    break;
                case "degHide":
                    builder.attribute(MathAttribute.DEGREE_HIDDEN, flagValue(value));
                    break;
                case "subHide":
                    builder.attribute(MathAttribute.SUB_HIDDEN, flagValue(value));
                    break;
                case "supHide":
                    builder.attribute(MathAttribute.SUP_HIDDEN, flagValue(value));
                    break;
                default:
                    break;
            }
        }
    }

    // on/off properties written without a value are switched on
    private static String flagValue(String value) {
        return value != null ? value : "1";
    }

    private static String valueOf(Element property) {
        if (property.hasAttributeNS(OMML_NAMESPACE, "val")) {
            return property.getAttributeNS(OMML_NAMESPACE, "val");
        }
        if (property.hasAttribute("val")) {
            return property.getAttribute("val");
        }
        return null;
    }

    private static boolean isMathElement(Element element) {
        String namespace = element.getNamespaceURI();
        return namespace == null || OMML_NAMESPACE.equals(namespace);
    }

    private static String localName(Element element) {
        return element.getLocalName() != null ? element.getLocalName() : element.getNodeName();
    }

    private static List<Element> childElements(Element parent) {
        List<Element> result = new ArrayList<>();
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child.getNodeType() == Node.ELEMENT_NODE) {
                result.add((Element) child);
            }
        }
        return result;
    }
}
