package io.logictree.cli.xml;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.logictree.core.exception.LogicTreeFormatException;
import io.logictree.core.source.SourceNode;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class XmlSourceReaderTest {

    private static SourceNode parse(String xml) throws Exception {
        try (InputStream in = new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8))) {
            return XmlSourceReader.read(in, "inline.xml");
        }
    }

    @Test
    void shouldQualifyNamespacedTags() throws Exception {
        SourceNode root =
                parse(
                        """
                        <nrml xmlns="http://openquake.org/xmlns/nrml/0.5">
                            <logicTree logicTreeID="lt1"/>
                        </nrml>
                        """);

        assertThat(root.tag()).isEqualTo("{http://openquake.org/xmlns/nrml/0.5}nrml");
        assertThat(root.localName()).isEqualTo("nrml");
        assertThat(root.children()).hasSize(1);
        assertThat(root.children().get(0).attribute("logicTreeID")).isEqualTo("lt1");
    }

    @Test
    void shouldDropNamespaceDeclarations() throws Exception {
        SourceNode root =
                parse(
                        """
                        <nrml xmlns="urn:a" xmlns:gml="urn:gml" version="1"/>
                        """);

        assertThat(root.attributes()).containsOnlyKeys("version");
    }

    @Test
    void shouldTrimTextAndIgnoreComments() throws Exception {
        SourceNode root =
                parse(
                        """
                        <logicTreeBranch branchID="b1">
                            <!-- model -->
                            <uncertaintyModel>
                                BooreAtkinson2008
                            </uncertaintyModel>
                            <uncertaintyWeight>0.3</uncertaintyWeight>
                        </logicTreeBranch>
                        """);

        assertThat(root.text()).isNull();
        assertThat(root.children()).hasSize(2);
        assertThat(root.child("uncertaintyModel"))
                .map(SourceNode::text)
                .hasValue("BooreAtkinson2008");
        assertThat(root.child("uncertaintyWeight")).map(SourceNode::text).hasValue("0.3");
    }

    @Test
    void shouldKeepUnqualifiedTags() throws Exception {
        SourceNode root = parse("<logicTree><logicTreeBranchSet branchSetID=\"bs1\"/></logicTree>");

        assertThat(root.tag()).isEqualTo("logicTree");
        assertThat(root.children().get(0).attribute("branchSetID")).isEqualTo("bs1");
    }

    @Test
    void shouldRejectMalformedXml() {
        assertThatThrownBy(() -> parse("<nrml><logicTree></nrml>"))
                .isInstanceOf(LogicTreeFormatException.class)
                .hasMessageContaining("inline.xml");
    }

    @Test
    void shouldRejectDoctype() {
        String xml =
                """
                <?xml version="1.0"?>
                <!DOCTYPE nrml [<!ENTITY x "boom">]>
                <nrml>&x;</nrml>
                """;

        assertThatThrownBy(() -> parse(xml)).isInstanceOf(LogicTreeFormatException.class);
    }
}
