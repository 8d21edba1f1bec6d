package io.simconvert.core.codec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.simconvert.core.error.ConverterException;
import io.simconvert.core.error.DocumentParseException;
import io.simconvert.core.model.Node;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link XmlDocumentCodec}. */
@DisplayName("XmlDocumentCodec")
class XmlDocumentCodecTest {

    private final XmlDocumentCodec codec = new XmlDocumentCodec();

    @Nested
    @DisplayName("Reading")
    class Reading {

        @Test
        void buildsTreeWithAttributesAndText() {
            Node root = codec.read("<Simulation Version=\"3\" Name=\"Sim\"><Zone><Area>2.5</Area></Zone></Simulation>");

            assertThat(root.tag()).isEqualTo("Simulation");
            assertThat(root.attributes().keySet()).containsExactly("Version", "Name");
            Node zone = root.child(0);
            assertThat(zone.parent()).isSameAs(root);
            assertThat(zone.childText("Area")).contains("2.5");
        }

        @Test
        void dropsIndentation() {
            Node root = codec.read("<Simulation>\n  <Zone>\n    <Name>Field</Name>\n  </Zone>\n</Simulation>\n");

            assertThat(root.hasText()).isFalse();
            assertThat(root.child(0).hasText()).isFalse();
            assertThat(root.child(0).childText("Name")).contains("Field");
        }

        @Test
        void keepsSignificantWhitespaceInsideText() {
            Node root = codec.read("<a><b>  padded  </b></a>");

            assertThat(root.child(0).text()).isEqualTo("  padded  ");
        }

        @Test
        void marksCData() {
            Node root = codec.read("<Manager>\n  <Code><![CDATA[if (a < b) { x(); }]]></Code>\n</Manager>");

            Node code = root.child(0);
            assertThat(code.isCData()).isTrue();
            assertThat(code.text()).isEqualTo("if (a < b) { x(); }");
        }

        @Test
        void decodesEntities() {
            Node root = codec.read("<a><b>x &lt; y &amp;&amp; z</b></a>");

            assertThat(root.child(0).text()).isEqualTo("x < y && z");
            assertThat(root.child(0).isCData()).isFalse();
        }

        @Test
        void keepsPrefixedNamesVerbatim() {
            Node root = codec.read(
                    "<Simulation xmlns:xsi=\"http://www.w3.org/2001/XMLSchema-instance\">"
                            + "<Model xsi:type=\"Zone\"/></Simulation>");

            assertThat(root.attribute("xmlns:xsi")).isEqualTo("http://www.w3.org/2001/XMLSchema-instance");
            assertThat(root.child(0).attribute("xsi:type")).isEqualTo("Zone");
        }

        @Test
        void skipsCommentsAndProcessingInstructions() {
            Node root = codec.read("<?xml version=\"1.0\"?><!-- header --><a><?pi data?><b/><!-- c --></a>");

            assertThat(root.children()).extracting(Node::tag).containsExactly("b");
        }

        @Test
        void readsFromStreamUsingDeclaredEncoding() {
            byte[] bytes = "<?xml version=\"1.0\" encoding=\"UTF-8\"?><a><b>Müller</b></a>"
                    .getBytes(StandardCharsets.UTF_8);

            Node root = codec.read(new ByteArrayInputStream(bytes), "mem.apsimx");

            assertThat(root.child(0).text()).isEqualTo("Müller");
        }

        @Test
        void malformedInputIsAParseException() {
            assertThatThrownBy(() -> codec.read(new ByteArrayInputStream("<a><b></a>".getBytes(StandardCharsets.UTF_8)),
                            "broken.apsimx"))
                    .isInstanceOf(DocumentParseException.class)
                    .hasMessageContaining("broken.apsimx")
                    .satisfies(e -> {
                        DocumentParseException parse = (DocumentParseException) e;
                        assertThat(parse.source()).isEqualTo("broken.apsimx");
                        assertThat(parse.phase()).isEqualTo(ConverterException.Phase.LOAD);
                    });
        }

        @Test
        void emptyInputIsAParseException() {
            assertThatThrownBy(() -> codec.read("")).isInstanceOf(DocumentParseException.class);
        }
    }

    @Nested
    @DisplayName("Writing")
    class Writing {

        @Test
        void writesCompactly() {
            Node root = new Node("Simulation");
            root.setAttribute("Version", "11");
            Node zone = root.addChild(new Node("Zone"));
            zone.addChild(Node.leaf("Name", "Field"));
            zone.addChild(new Node("SoluteManager"));

            assertThat(codec.write(root))
                    .isEqualTo("<Simulation Version=\"11\"><Zone><Name>Field</Name><SoluteManager/></Zone></Simulation>");
        }

        @Test
        void escapesTextAndAttributes() {
            Node root = Node.leaf("a", "x < y & z");
            root.setAttribute("q", "say \"hi\" & <go>");

            String xml = codec.write(root);

            assertThat(xml).contains("x &lt; y &amp; z").contains("&quot;hi&quot;").contains("&amp;");
            assertThat(codec.read(xml)).isEqualTo(root);
        }

        @Test
        void writesCDataAsCData() {
            Node root = new Node("Manager");
            root.addChild(Node.cdataLeaf("Code", "if (a < b) {}"));

            assertThat(codec.write(root)).isEqualTo("<Manager><Code><![CDATA[if (a < b) {}]]></Code></Manager>");
        }

        @Test
        void writesPrefixedNamesVerbatim() {
            Node root = new Node("Simulation");
            root.setAttribute("xmlns:xsi", "http://www.w3.org/2001/XMLSchema-instance");
            root.addChild(new Node("Model")).setAttribute("xsi:type", "Zone");

            String xml = codec.write(root);

            assertThat(xml)
                    .isEqualTo("<Simulation xmlns:xsi=\"http://www.w3.org/2001/XMLSchema-instance\">"
                            + "<Model xsi:type=\"Zone\"/></Simulation>");
            assertThat(codec.read(xml)).isEqualTo(root);
        }

        @Test
        void declarationIsOptional() {
            XmlDocumentCodec withDeclaration = new XmlDocumentCodec(true);
            ByteArrayOutputStream out = new ByteArrayOutputStream();

            withDeclaration.write(new Node("a"), out);

            String xml = out.toString(StandardCharsets.UTF_8);
            assertThat(xml).startsWith("<?xml").contains("UTF-8").endsWith("<a/>");
            assertThat(codec.write(new Node("a"))).isEqualTo("<a/>");
        }

        @Test
        void readWriteKeepsStructure() {
            String xml = "<Simulation Version=\"11\"><Manager><Code><![CDATA[using System;\nclass A {}\n]]></Code>"
                    + "</Manager><Report><VariableNames><string>[Clock].Today</string></VariableNames></Report>"
                    + "</Simulation>";

            assertThat(codec.write(codec.read(xml))).isEqualTo(xml);
        }
    }
}
