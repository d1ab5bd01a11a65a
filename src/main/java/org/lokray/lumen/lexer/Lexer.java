package org.lokray.lumen.lexer;

import org.lokray.lumen.util.Debug;
import org.lokray.lumen.util.ErrorReporter;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * The Lexer is responsible for performing lexical analysis (scanning).
 * It reads raw Lumen source code and converts it into a stream of Tokens,
 * skipping whitespace and {@code #} comments.
 * <p>
 * The Lexer is {@link Iterable}: every call to {@link #iterator()} starts a fresh,
 * lazy scan from the beginning of the source, so a Lexer can be consumed more than once.
 * Illegal characters are reported to the ErrorReporter as the scan reaches them;
 * they are skipped and scanning continues.
 */
public class Lexer implements Iterable<Token>
{
	private final String source; // The raw source code string
	private final ErrorReporter errorReporter; // For reporting lexical errors

	// Reserved words, matched case-insensitively
	private static final Map<String, TokenType> keywords;

	static
	{
		keywords = new HashMap<>();
		keywords.put("IF", TokenType.IF);
		keywords.put("ELSE", TokenType.ELSE);
		keywords.put("WHILE", TokenType.WHILE);
		keywords.put("AND", TokenType.AND);
		keywords.put("OR", TokenType.OR);
		keywords.put("NOT", TokenType.NOT);
		keywords.put("TRUE", TokenType.BOOLEAN_LITERAL);
		keywords.put("FALSE", TokenType.BOOLEAN_LITERAL);
	}

	/**
	 * Constructs a Lexer.
	 *
	 * @param source        The source code string to tokenize.
	 * @param errorReporter An instance of ErrorReporter for collecting lexical errors.
	 */
	public Lexer(String source, ErrorReporter errorReporter)
	{
		this.source = source != null ? source : "";
		this.errorReporter = errorReporter;
	}

	/**
	 * Scans the entire source code and returns the list of tokens, ending with EOF.
	 */
	public List<Token> scanTokens()
	{
		List<Token> tokens = new ArrayList<>();
		for (Token token : this)
		{
			tokens.add(token);
		}
		Debug.log("Lexer produced %d tokens.", tokens.size());
		return tokens;
	}

	@Override
	public Iterator<Token> iterator()
	{
		return new TokenIterator();
	}

	/**
	 * Looks up a reserved word. Keywords are case-insensitive: {@code while}, {@code While}
	 * and {@code WHILE} are the same token.
	 *
	 * @return The keyword's TokenType, or null if the text is an ordinary identifier.
	 */
	static TokenType keyword(String text)
	{
		return keywords.get(text.toUpperCase(Locale.ROOT));
	}

	/**
	 * One pass over the source. Holds all of the scanning state, so iterators never interfere.
	 */
	private class TokenIterator implements Iterator<Token>
	{
		private int start = 0; // Current token's starting position in the source
		private int current = 0; // Current position in the source
		private int line = 1; // Current line number

		private Token pending; // Token produced by the last scanToken() call, if any
		private Token lookahead; // Token returned by the next call to next()
		private boolean finished = false; // EOF has been handed out

		@Override
		public boolean hasNext()
		{
			if (lookahead == null && !finished)
			{
				lookahead = scanNext();
			}
			return lookahead != null;
		}

		@Override
		public Token next()
		{
			if (!hasNext())
			{
				throw new NoSuchElementException("The lexer has already produced EOF.");
			}
			Token token = lookahead;
			lookahead = null;
			if (token.is(TokenType.EOF))
			{
				finished = true;
			}
			return token;
		}

		private Token scanNext()
		{
			while (!isAtEnd())
			{
				start = current; // Mark the beginning of the current token
				pending = null;
				scanToken();
				if (pending != null)
				{
					return pending;
				}
			}
			start = current;
			return new Token(TokenType.EOF, "", null, line, columnOf(current));
		}

		/**
		 * Scans a single lexeme. Whitespace, newlines, comments and illegal characters leave no token.
		 */
		private void scanToken()
		{
			char c = advance();

			switch (c)
			{
				case '(':
					addToken(TokenType.LEFT_PAREN);
					break;
				case ')':
					addToken(TokenType.RIGHT_PAREN);
					break;
				case '{':
					addToken(TokenType.LEFT_BRACE);
					break;
				case '}':
					addToken(TokenType.RIGHT_BRACE);
					break;
				case '+':
					addToken(TokenType.PLUS);
					break;
				case '-':
					addToken(TokenType.MINUS);
					break;
				case '*':
					addToken(TokenType.STAR);
					break;
				case '/':
					addToken(TokenType.SLASH);
					break;

				// --- Two-character operators are tried before their one-character prefix ---
				case '<':
					addToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS);
					break;
				case '>':
					addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER);
					break;
				case '=':
					addToken(match('=') ? TokenType.EQUAL_EQUAL : TokenType.ASSIGN);
					break;
				case '!':
					if (match('='))
					{
						addToken(TokenType.BANG_EQUAL);
					}
					else
					{
						illegalCharacter(c);
					}
					break;

				case '#':
					// A comment goes until the end of the line; the newline itself is scanned normally.
					while (peek() != '\n' && !isAtEnd())
					{
						advance();
					}
					break;

				// --- Whitespace ---
				case ' ':
				case '\r':
				case '\t':
					break;
				case '\n':
					line++;
					break;

				default:
					if (isDigit(c) || (c == '.' && isDigit(peek())))
					{
						scanNumber();
					}
					else if (isAlpha(c))
					{
						scanIdentifier();
					}
					else
					{
						illegalCharacter(c);
					}
					break;
			}
		}

		/**
		 * Scans {@code \d+(\.\d*)?} or {@code \.\d+}. The value is always a double;
		 * the language has no separate integer type.
		 */
		private void scanNumber()
		{
			boolean seenDot = source.charAt(start) == '.';
			while (isDigit(peek()))
			{
				advance();
			}
			if (!seenDot && peek() == '.')
			{
				advance(); // "5." is a complete literal
				while (isDigit(peek()))
				{
					advance();
				}
			}
			String text = source.substring(start, current);
			addToken(TokenType.NUMBER_LITERAL, Double.parseDouble(text));
		}

		private void scanIdentifier()
		{
			while (isAlphaNumeric(peek()))
			{
				advance();
			}

			String text = source.substring(start, current);
			TokenType type = keyword(text);
			if (type == null)
			{
				addToken(TokenType.IDENTIFIER);
			}
			else if (type == TokenType.BOOLEAN_LITERAL)
			{
				addToken(type, "TRUE".equalsIgnoreCase(text));
			}
			else
			{
				addToken(type);
			}
		}

		private void illegalCharacter(char c)
		{
			errorReporter.lexical(line, columnOf(start), "Caracter ilegal '" + c + "'");
		}

		/**
		 * Column of a source offset, counted from the most recent newline; the first character of a line is column 1.
		 */
		private int columnOf(int offset)
		{
			int lineStart = source.lastIndexOf('\n', offset - 1);
			return offset - lineStart;
		}

		private void addToken(TokenType type)
		{
			addToken(type, null);
		}

		private void addToken(TokenType type, Object literal)
		{
			String text = source.substring(start, current);
			pending = new Token(type, text, literal, line, columnOf(start));
		}

		private char advance()
		{
			return source.charAt(current++);
		}

		/**
		 * Consumes the current character only if it is the expected one.
		 */
		private boolean match(char expected)
		{
			if (isAtEnd() || source.charAt(current) != expected)
			{
				return false;
			}
			current++;
			return true;
		}

		private char peek()
		{
			if (isAtEnd())
			{
				return '\0';
			}
			return source.charAt(current);
		}

		private boolean isAtEnd()
		{
			return current >= source.length();
		}
	}

	private static boolean isDigit(char c)
	{
		return c >= '0' && c <= '9';
	}

	// ASCII only: identifiers are [A-Za-z_][A-Za-z0-9_]*
	private static boolean isAlpha(char c)
	{
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
	}

	private static boolean isAlphaNumeric(char c)
	{
		return isAlpha(c) || isDigit(c);
	}
}
