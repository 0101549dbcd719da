package org.javai.asciidoc.ast;

public enum ListKind {
	UNORDERED,
	ORDERED
}
