package org.lokray.lumen.lexer;

/**
 * Defines the types of tokens recognized by the Lumen Lexer.
 */
public enum TokenType
{
	// --- Keywords ---
	IF, ELSE, WHILE,
	AND, OR, NOT,

	// --- Literals ---
	IDENTIFIER,
	NUMBER_LITERAL,
	BOOLEAN_LITERAL,

	// --- Punctuation ---
	LEFT_PAREN, RIGHT_PAREN,       // ( )
	LEFT_BRACE, RIGHT_BRACE,       // { }

	// --- Operators ---
	PLUS, MINUS,                   // + -
	STAR, SLASH,                   // * /
	ASSIGN,                        // =
	LESS, LESS_EQUAL,              // < <=
	GREATER, GREATER_EQUAL,        // > >=
	EQUAL_EQUAL, BANG_EQUAL,       // == !=

	EOF
}
