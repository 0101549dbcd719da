package org.javai.asciidoc.ast;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Utility to convert a parsed {@link Document} into a JSON tree for tooling and debugging.
 * <p>
 * Every node is an object with a {@code "type"} discriminator and a {@code "span"} of
 * {@code [start, end]}.
 */
public final class AstJsonMapper {

	private static final ObjectMapper mapper = new ObjectMapper();

	private AstJsonMapper() {
	}

	public static ObjectNode toJson(Document document) {
		ObjectNode node = typed("document", document.span());
		ObjectNode attributes = node.putObject("attributes");
		document.attributes().forEach((name, value) -> putAttributeValue(attributes, name, value));
		if (document.header() != null) {
			node.set("header", toJson(document.header()));
		}
		node.set("blocks", toJsonArray(document.blocks()));
		ArrayNode includes = node.putArray("includes");
		for (IncludeRecord include : document.includes()) {
			ObjectNode includeNode = includes.addObject();
			includeNode.put("target", include.target());
			includeNode.put("path", include.path().toString());
			includeNode.set("span", span(include.span()));
		}
		return node;
	}

	public static ObjectNode toJson(Header header) {
		ObjectNode node = typed("header", header.span());
		node.set("title", inlinesToJson(header.title()));
		if (header.author() != null) {
			node.put("author", header.author());
		}
		if (header.email() != null) {
			node.put("email", header.email());
		}
		if (header.revision() != null) {
			node.put("revision", header.revision());
		}
		ObjectNode attributes = node.putObject("attributes");
		header.attributes().forEach((name, value) -> putAttributeValue(attributes, name, value));
		return node;
	}

	public static ObjectNode toJson(Block block) {
		if (block instanceof Block.Section section) {
			ObjectNode node = typed("section", section.span());
			node.put("level", section.level());
			node.put("id", section.id());
			node.set("title", inlinesToJson(section.title()));
			putAttributes(node, section.attributes());
			node.set("blocks", toJsonArray(section.blocks()));
			return node;
		}
		if (block instanceof Block.Paragraph paragraph) {
			ObjectNode node = typed("paragraph", paragraph.span());
			putAttributes(node, paragraph.attributes());
			node.set("content", inlinesToJson(paragraph.content()));
			return node;
		}
		if (block instanceof Block.Delimited delimited) {
			ObjectNode node = typed("delimited", delimited.span());
			node.put("kind", delimited.kind().name().toLowerCase(Locale.ROOT));
			putAttributes(node, delimited.attributes());
			if (delimited.content() instanceof BlockContent.Verbatim verbatim) {
				node.put("text", verbatim.text());
			} else {
				node.set("blocks", toJsonArray(delimited.blocks()));
			}
			return node;
		}
		if (block instanceof Block.ListBlock list) {
			ObjectNode node = typed("list", list.span());
			node.put("kind", list.kind().name().toLowerCase(Locale.ROOT));
			if (list.style() != null) {
				node.put("style", list.style().attributeName());
			}
			node.put("marker", list.marker());
			putAttributes(node, list.attributes());
			ArrayNode items = node.putArray("items");
			for (ListItem item : list.items()) {
				ObjectNode itemNode = typed("item", item.span());
				itemNode.set("content", inlinesToJson(item.content()));
				itemNode.set("blocks", toJsonArray(item.blocks()));
				items.add(itemNode);
			}
			return node;
		}
		if (block instanceof Block.Table table) {
			ObjectNode node = typed("table", table.span());
			putAttributes(node, table.attributes());
			if (table.header() != null) {
				node.set("header", rowToJson(table.header()));
			}
			ArrayNode rows = node.putArray("rows");
			for (TableRow row : table.rows()) {
				rows.add(rowToJson(row));
			}
			return node;
		}
		Block.BlockMacro macro = (Block.BlockMacro) block;
		ObjectNode node = typed("block_macro", macro.span());
		node.put("name", macro.name());
		node.put("target", macro.target());
		putAttributes(node, macro.attributes());
		return node;
	}

	public static ObjectNode toJson(Inline inline) {
		if (inline instanceof Inline.Text text) {
			ObjectNode node = typed("text", text.span());
			node.put("text", text.text());
			return node;
		}
		if (inline instanceof Inline.Formatted formatted) {
			ObjectNode node = typed("formatted", formatted.span());
			node.put("style", formatted.style().name().toLowerCase(Locale.ROOT));
			node.set("content", inlinesToJson(formatted.content()));
			return node;
		}
		if (inline instanceof Inline.Macro macro) {
			ObjectNode node = typed("macro", macro.span());
			node.put("name", macro.name());
			node.put("target", macro.target());
			putAttributes(node, macro.attributes());
			return node;
		}
		if (inline instanceof Inline.Link link) {
			ObjectNode node = typed("link", link.span());
			node.put("url", link.url());
			if (link.text() != null) {
				node.put("text", link.text());
			}
			return node;
		}
		if (inline instanceof Inline.AttributeRef ref) {
			ObjectNode node = typed("attribute_ref", ref.span());
			node.put("name", ref.name());
			return node;
		}
		return typed("line_break", inline.span());
	}

	public static ArrayNode toJsonArray(List<Block> blocks) {
		ArrayNode array = mapper.createArrayNode();
		for (Block block : blocks) {
			array.add(toJson(block));
		}
		return array;
	}

	/**
	 * Serializes the document as indented JSON text.
	 */
	public static String toJsonString(Document document) {
		return toJson(document).toPrettyString();
	}

	private static ArrayNode inlinesToJson(List<Inline> inlines) {
		ArrayNode array = mapper.createArrayNode();
		for (Inline inline : inlines) {
			array.add(toJson(inline));
		}
		return array;
	}

	private static ObjectNode rowToJson(TableRow row) {
		ObjectNode node = typed("row", row.span());
		ArrayNode cells = node.putArray("cells");
		for (TableCell cell : row.cells()) {
			ObjectNode cellNode = typed("cell", cell.span());
			cellNode.put("style", cell.style().name().toLowerCase(Locale.ROOT));
			if (cell.style() == CellStyle.ASCIIDOC) {
				cellNode.set("blocks", toJsonArray(cell.blocks()));
			} else {
				cellNode.set("content", inlinesToJson(cell.content()));
			}
			cells.add(cellNode);
		}
		return node;
	}

	private static ObjectNode typed(String type, Span span) {
		ObjectNode node = mapper.createObjectNode();
		node.put("type", type);
		node.set("span", span(span));
		return node;
	}

	private static ArrayNode span(Span span) {
		return mapper.createArrayNode().add(span.start()).add(span.end());
	}

	private static void putAttributes(ObjectNode node, Map<String, String> attributes) {
		if (attributes.isEmpty()) {
			return;
		}
		ObjectNode attributesNode = node.putObject("attributes");
		attributes.forEach(attributesNode::put);
	}

	private static void putAttributeValue(ObjectNode node, String name, AttributeValue value) {
		if (value instanceof AttributeValue.TextValue text) {
			node.put(name, text.text());
		} else if (value instanceof AttributeValue.BoolValue bool) {
			node.put(name, bool.value());
		} else if (value instanceof AttributeValue.IntValue number) {
			node.put(name, number.value());
		} else {
			node.putNull(name);
		}
	}
}
