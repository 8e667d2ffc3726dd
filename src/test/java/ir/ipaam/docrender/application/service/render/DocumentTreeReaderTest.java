package ir.ipaam.docrender.application.service.render;

import com.fasterxml.jackson.databind.ObjectMapper;
import ir.ipaam.docrender.domain.exception.InvalidDocumentException;
import ir.ipaam.docrender.domain.model.document.Block;
import ir.ipaam.docrender.domain.model.document.BlockType;
import ir.ipaam.docrender.domain.model.document.DocumentTree;
import ir.ipaam.docrender.domain.model.document.InlineRun;
import ir.ipaam.docrender.domain.model.document.TextAlign;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentTreeReaderTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final DocumentTreeReader reader = new DocumentTreeReader();

    @Test
    void shouldReadBlockStructure() throws Exception {
        DocumentTree tree = read("""
                {"type":"doc","content":[
                  {"type":"heading","attrs":{"level":7,"textAlign":"CENTER"},"content":[{"type":"text","text":"Title"}]},
                  {"type":"orderedList","attrs":{"start":3},"content":[
                    {"type":"listItem","content":[{"type":"paragraph"}]}
                  ]},
                  {"type":"blockquote","content":[{"type":"paragraph","content":[]}]},
                  {"type":"codeBlock","content":[{"type":"text","text":"a\\r\\nb"}]},
                  {"type":"horizontalRule"},
                  {"type":"table","content":[{"type":"paragraph"}]}
                ]}
                """);

        assertThat(tree.blocks()).extracting(Block::type).containsExactly(
                BlockType.HEADING, BlockType.ORDERED_LIST, BlockType.BLOCKQUOTE,
                BlockType.CODE_BLOCK, BlockType.HORIZONTAL_RULE, BlockType.UNKNOWN);

        Block heading = tree.blocks().get(0);
        assertThat(heading.level()).isEqualTo(3);
        assertThat(heading.align()).isEqualTo(TextAlign.CENTER);

        Block list = tree.blocks().get(1);
        assertThat(list.start()).isEqualTo(3);
        assertThat(list.children()).singleElement().extracting(Block::type).isEqualTo(BlockType.LIST_ITEM);

        assertThat(tree.blocks().get(3).inline()).singleElement()
                .extracting(InlineRun::text).isEqualTo("a\nb");
        assertThat(tree.blocks().get(5).nodeType()).isEqualTo("table");
        assertThat(tree.blocks().get(5).children()).hasSize(1);
    }

    @Test
    void shouldReadMarks() throws Exception {
        DocumentTree tree = read("""
                {"type":"doc","content":[{"type":"paragraph","content":[
                  {"type":"text","text":"styled","marks":[
                    {"type":"bold"},{"type":"italic"},{"type":"underline"},{"type":"strike"},
                    {"type":"textStyle","attrs":{"fontFamily":"Georgia","fontSize":"18px","color":"#112233"}},
                    {"type":"highlight"},
                    {"type":"link","attrs":{"href":"https://example.com"}}
                  ]},
                  {"type":"hardBreak"},
                  {"type":"text","text":"x","marks":[{"type":"superscript"},{"type":"code"}]},
                  {"type":"mention","attrs":{"id":"7"}}
                ]}]}
                """);

        var inline = tree.blocks().get(0).inline();
        assertThat(inline).hasSize(3);

        InlineRun styled = inline.get(0);
        assertThat(styled.bold()).isTrue();
        assertThat(styled.italic()).isTrue();
        assertThat(styled.underline()).isTrue();
        assertThat(styled.strike()).isTrue();
        assertThat(styled.fontFamily()).isEqualTo("Georgia");
        assertThat(styled.fontSize()).isEqualTo("18px");
        assertThat(styled.color()).isEqualTo("#112233");
        assertThat(styled.highlight()).isEqualTo(DocumentTreeReader.DEFAULT_HIGHLIGHT);

        assertThat(inline.get(1).text()).isEqualTo("\n");
        assertThat(inline.get(2).superscript()).isTrue();
        assertThat(inline.get(2).fontFamily()).isEqualTo("monospace");
    }

    @Test
    void shouldReadTextAlignIgnoringCaseAndFallBackToLeft() throws Exception {
        DocumentTree tree = read("""
                {"type":"doc","content":[
                  {"type":"paragraph","attrs":{"textAlign":"Center"},"content":[{"type":"text","text":"a"}]},
                  {"type":"paragraph","attrs":{"textAlign":" justify "},"content":[{"type":"text","text":"b"}]},
                  {"type":"paragraph","attrs":{"textAlign":"diagonal"},"content":[{"type":"text","text":"c"}]},
                  {"type":"paragraph","content":[{"type":"text","text":"d"}]}
                ]}
                """);

        assertThat(tree.blocks()).extracting(Block::align).containsExactly(
                TextAlign.CENTER, TextAlign.JUSTIFY, TextAlign.LEFT, TextAlign.LEFT);
    }

    @Test
    void shouldAcceptMissingContent() throws Exception {
        assertThat(read("{\"type\":\"doc\"}").blocks()).isEmpty();
    }

    @Test
    void shouldRejectMissingOrNonObjectRoot() throws Exception {
        assertThatThrownBy(() -> reader.read(null)).isInstanceOf(InvalidDocumentException.class);
        assertThatThrownBy(() -> reader.read(objectMapper.readTree("[]")))
                .isInstanceOf(InvalidDocumentException.class)
                .hasMessageContaining("object");
    }

    @Test
    void shouldRejectRootThatIsNotDoc() {
        assertThatThrownBy(() -> read("{\"type\":\"paragraph\"}"))
                .isInstanceOf(InvalidDocumentException.class)
                .hasMessageContaining("'doc'");
    }

    @Test
    void shouldRejectContentThatIsNotAList() {
        assertThatThrownBy(() -> read("{\"type\":\"doc\",\"content\":{\"type\":\"paragraph\"}}"))
                .isInstanceOf(InvalidDocumentException.class)
                .hasMessageContaining("'content' of doc");
    }

    @Test
    void shouldRejectMarksThatAreNotAList() {
        assertThatThrownBy(() -> read("""
                {"type":"doc","content":[{"type":"paragraph","content":[
                  {"type":"text","text":"x","marks":{"type":"bold"}}
                ]}]}
                """))
                .isInstanceOf(InvalidDocumentException.class)
                .hasMessageContaining("doc.content[0].content[0]");
    }

    @Test
    void shouldRejectTextNodeWithoutString() {
        assertThatThrownBy(() -> read("""
                {"type":"doc","content":[{"type":"paragraph","content":[{"type":"text","text":42}]}]}
                """))
                .isInstanceOf(InvalidDocumentException.class);
    }

    private DocumentTree read(String json) throws Exception {
        return reader.read(objectMapper.readTree(json));
    }
}
