package org.metricshub.jpol.frontend;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Jpol
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.io.IOException;
import java.io.Reader;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import org.metricshub.jpol.model.Header;
import org.metricshub.jpol.model.LogLimit;
import org.metricshub.jpol.model.NoTermsException;
import org.metricshub.jpol.model.Policy;
import org.metricshub.jpol.model.Target;
import org.metricshub.jpol.model.Term;
import org.metricshub.jpol.model.VarType;
import org.metricshub.jpol.model.Verbatim;
import org.metricshub.jpol.model.Vpn;
import org.metricshub.jpol.naming.Naming;
import org.metricshub.jpol.util.JpolLogger;
import org.metricshub.jpol.util.ParseContext;
import org.slf4j.Logger;

/**
 * Converts policy text into a {@link Policy}: a list of filters, each made
 * of a {@link Header} and its {@link Term}s.
 * <p>
 * The lexer and the recursive descent parser live in this class, the lexer
 * reading one character ahead and the parser one token ahead. Newlines and
 * <code>#</code> comments are skipped by the lexer; every attribute line
 * starts with its keyword, which is enough to tell where the previous value
 * list ends.
 * <p>
 * Attribute values are handed to {@link Term#addObject(VarType, Naming)} and
 * {@link Header#addObject(VarType)} as soon as they are parsed. Network names
 * are therefore resolved during parsing, using the naming service of the
 * {@link ParseContext}.
 * <p>
 * The text is expected to be already free of <code>#include</code> directives
 * (see {@link IncludePreprocessor}).
 */
public class PolicyParser {

	private static final Logger LOG = JpolLogger.getLogger(PolicyParser.class);

	/** Lexer token values. */
	enum Token {
		EOF,
		COLON,
		COMMA,
		OPEN_BRACE,
		CLOSE_BRACE,
		OPEN_PAREN,
		CLOSE_PAREN,
		OPEN_BRACKET,
		CLOSE_BRACKET,
		DASH,
		SLASH,

		STRING,
		INTEGER,
		HEX,
		DQUOTEDSTRING,
		DSCP,
		DSCP_RANGE,

		KW_HEADER,
		KW_TERM,
		ATTRIBUTE
	}

	/**
	 * Block keywords. Attribute names are in {@link #ATTRIBUTES}.
	 */
	private static final Map<String, Token> KEYWORDS = new HashMap<String, Token>();

	static {
		KEYWORDS.put("header", Token.KW_HEADER);
		KEYWORDS.put("term", Token.KW_TERM);
	}

	/**
	 * Attribute names, lexed as {@link Token#ATTRIBUTE}, and the kind of
	 * value each one produces.
	 */
	private static final Map<String, VarType.Kind> ATTRIBUTES = new HashMap<String, VarType.Kind>();

	static {
		ATTRIBUTES.put("action", VarType.Kind.ACTION);
		ATTRIBUTES.put("address", VarType.Kind.ADDRESS);
		ATTRIBUTES.put("address-exclude", VarType.Kind.ADDREXCLUDE);
		ATTRIBUTES.put("apply-groups", VarType.Kind.APPLY_GROUPS);
		ATTRIBUTES.put("apply-groups-except", VarType.Kind.APPLY_GROUPS_EXCEPT);
		ATTRIBUTES.put("comment", VarType.Kind.COMMENT);
		ATTRIBUTES.put("counter", VarType.Kind.COUNTER);
		ATTRIBUTES.put("destination-address", VarType.Kind.DADDRESS);
		ATTRIBUTES.put("destination-exclude", VarType.Kind.DADDREXCLUDE);
		ATTRIBUTES.put("destination-interface", VarType.Kind.DINTERFACE);
		ATTRIBUTES.put("destination-port", VarType.Kind.DPORT);
		ATTRIBUTES.put("destination-prefix", VarType.Kind.DPFX);
		ATTRIBUTES.put("destination-prefix-except", VarType.Kind.DPFX_EXCEPT);
		ATTRIBUTES.put("destination-tag", VarType.Kind.DTAG);
		ATTRIBUTES.put("destination-zone", VarType.Kind.DZONE);
		ATTRIBUTES.put("dscp-except", VarType.Kind.DSCP_EXCEPT);
		ATTRIBUTES.put("dscp-match", VarType.Kind.DSCP_MATCH);
		ATTRIBUTES.put("dscp-set", VarType.Kind.DSCP_SET);
		ATTRIBUTES.put("encapsulate", VarType.Kind.ENCAPSULATE);
		ATTRIBUTES.put("ether-type", VarType.Kind.ETHER_TYPE);
		ATTRIBUTES.put("expiration", VarType.Kind.EXPIRATION);
		ATTRIBUTES.put("filter-term", VarType.Kind.FILTER_TERM);
		ATTRIBUTES.put("flexible-match-range", VarType.Kind.FLEXIBLE_MATCH_RANGE);
		ATTRIBUTES.put("forwarding-class", VarType.Kind.FORWARDING_CLASS);
		ATTRIBUTES.put("forwarding-class-except", VarType.Kind.FORWARDING_CLASS_EXCEPT);
		ATTRIBUTES.put("fragment-offset", VarType.Kind.FRAGMENT_OFFSET);
		ATTRIBUTES.put("hop-limit", VarType.Kind.HOP_LIMIT);
		ATTRIBUTES.put("icmp-code", VarType.Kind.ICMP_CODE);
		ATTRIBUTES.put("icmp-type", VarType.Kind.ICMP_TYPE);
		ATTRIBUTES.put("log-limit", VarType.Kind.LOG_LIMIT);
		ATTRIBUTES.put("log_name", VarType.Kind.LOG_NAME);
		ATTRIBUTES.put("logging", VarType.Kind.LOGGING);
		ATTRIBUTES.put("loss-priority", VarType.Kind.LOSS_PRIORITY);
		ATTRIBUTES.put("next-ip", VarType.Kind.NEXT_IP);
		ATTRIBUTES.put("option", VarType.Kind.OPTION);
		ATTRIBUTES.put("owner", VarType.Kind.OWNER);
		ATTRIBUTES.put("packet-length", VarType.Kind.PACKET_LEN);
		ATTRIBUTES.put("pan-application", VarType.Kind.PAN_APPLICATION);
		ATTRIBUTES.put("platform", VarType.Kind.PLATFORM);
		ATTRIBUTES.put("platform-exclude", VarType.Kind.PLATFORMEXCLUDE);
		ATTRIBUTES.put("policer", VarType.Kind.POLICER);
		ATTRIBUTES.put("port", VarType.Kind.PORT);
		ATTRIBUTES.put("port-mirror", VarType.Kind.PORT_MIRROR);
		ATTRIBUTES.put("precedence", VarType.Kind.PRECEDENCE);
		ATTRIBUTES.put("priority", VarType.Kind.PRIORITY);
		ATTRIBUTES.put("protocol", VarType.Kind.PROTOCOL);
		ATTRIBUTES.put("protocol-except", VarType.Kind.PROTOCOL_EXCEPT);
		ATTRIBUTES.put("qos", VarType.Kind.QOS);
		ATTRIBUTES.put("restrict-address-family", VarType.Kind.RESTRICT_ADDRESS_FAMILY);
		ATTRIBUTES.put("routing-instance", VarType.Kind.ROUTING_INSTANCE);
		ATTRIBUTES.put("source-address", VarType.Kind.SADDRESS);
		ATTRIBUTES.put("source-exclude", VarType.Kind.SADDREXCLUDE);
		ATTRIBUTES.put("source-interface", VarType.Kind.SINTERFACE);
		ATTRIBUTES.put("source-port", VarType.Kind.SPORT);
		ATTRIBUTES.put("source-prefix", VarType.Kind.SPFX);
		ATTRIBUTES.put("source-prefix-except", VarType.Kind.SPFX_EXCEPT);
		ATTRIBUTES.put("source-tag", VarType.Kind.STAG);
		ATTRIBUTES.put("source-zone", VarType.Kind.SZONE);
		ATTRIBUTES.put("target", VarType.Kind.TARGET);
		ATTRIBUTES.put("target-resources", VarType.Kind.TARGET_RESOURCES);
		ATTRIBUTES.put("target-service-accounts", VarType.Kind.TARGET_SERVICE_ACCOUNTS);
		ATTRIBUTES.put("timeout", VarType.Kind.TIMEOUT);
		ATTRIBUTES.put("traffic-class-count", VarType.Kind.TRAFFIC_CLASS_COUNT);
		ATTRIBUTES.put("traffic-type", VarType.Kind.TRAFFIC_TYPE);
		ATTRIBUTES.put("ttl", VarType.Kind.TTL);
		ATTRIBUTES.put("verbatim", VarType.Kind.VERBATIM);
		ATTRIBUTES.put("vpn", VarType.Kind.VPN);
	}

	private static final String DSCP_VALUE = "(?:b[01]{6}|af[1-4][1-3]|be|ef|cs[0-7])";
	private static final Pattern DSCP = Pattern.compile(DSCP_VALUE);
	private static final Pattern DSCP_RANGE = Pattern.compile(DSCP_VALUE + "-" + DSCP_VALUE);

	/** Characters allowed inside (not at the start of) an identifier, besides letters, digits and '_'. */
	private static final String WORD_PUNCTUATION = "-_+.@/";

	private static final Set<String> FLEXIBLE_MATCH_ATTRIBUTES = new HashSet<String>(Arrays.asList(
			"byte-offset",
			"bit-offset",
			"bit-length",
			"match-start",
			"range",
			"range-except",
			"flexible-range-name"));

	private static final Set<String> FLEXIBLE_MATCH_START = new HashSet<String>(Arrays.asList(
			"layer-3",
			"layer-4",
			"payload"));

	private static final Map<String, Integer> FLEXIBLE_MATCH_LIMITS = new HashMap<String, Integer>();

	static {
		FLEXIBLE_MATCH_LIMITS.put("bit-length", 32);
		FLEXIBLE_MATCH_LIMITS.put("bit-offset", 7);
		FLEXIBLE_MATCH_LIMITS.put("byte-offset", 255);
	}

	private final ParseContext context;

	private Reader reader;
	private int c;
	private int lineNumber;
	private int tokenLine;
	private Token token;
	private VarType.Kind attribute;

	private StringBuffer text = new StringBuffer();
	private StringBuffer string = new StringBuffer();

	/**
	 * <p>
	 * Constructor for PolicyParser.
	 * </p>
	 *
	 * @param context settings, naming service and file name of this parse
	 */
	public PolicyParser(ParseContext context) {
		this.context = context;
	}

	/**
	 * Parses the policy text served by <code>policyReader</code>.
	 *
	 * @param policyReader the include-free policy text
	 * @return the policy, with its terms built but neither validated nor normalized
	 * @throws java.io.IOException upon an IO error
	 * @throws LexerException on a character that starts no token
	 * @throws ParserException on a token the grammar does not allow there
	 * @throws NoTermsException when the text holds no filter at all
	 */
	public Policy parse(Reader policyReader) throws IOException {
		this.reader = policyReader;
		lineNumber = 1;
		c = ' ';
		read();
		lexer();
		return POLICY();
	}

	private void read() throws IOException {
		if (c == '\n') {
			lineNumber++;
		}
		text.append((char) c);
		c = reader.read();
		// completely bypass \r's
		while (c == '\r') {
			c = reader.read();
		}
	}

	private LexerException lexerException(String msg) {
		return new LexerException(msg, context.getFilename(), lineNumber);
	}

	private ParserException parserException(String msg) {
		if (token == Token.EOF) {
			return new UnbalancedBlockException(context.getFilename(), tokenLine);
		}
		return new ParserException(msg, text.toString(), token.name(), context.getFilename(), tokenLine);
	}

	/**
	 * Reads a quoted string into {@link #string}. A backslash only escapes the
	 * closing quote; any other backslash is kept.
	 */
	private void readString() throws IOException {
		int quote = c;
		string.setLength(0);
		read();
		while (c != quote) {
			if (c < 0) {
				throw lexerException("Unterminated string: " + text);
			}
			if (c == '\\') {
				read();
				if (c == quote) {
					string.append((char) c);
					read();
				} else {
					string.append('\\');
				}
				continue;
			}
			string.append((char) c);
			read();
		}
		read();
	}

	private static boolean isWordStart(int ch) {
		return ch == '_' || Character.isLetterOrDigit(ch);
	}

	private static boolean isWordPart(int ch) {
		return isWordStart(ch) || (ch >= 0 && WORD_PUNCTUATION.indexOf(ch) >= 0);
	}

	private Token lexer(Token expectedToken) throws IOException {
		if (token != expectedToken) {
			throw parserException(
					"Expecting " + expectedToken.name() + ". Found: " + token.name() + " (" + text + ")");
		}
		return lexer();
	}

	private Token lexer() throws IOException {
		// clear whitespace and comments
		while (c == ' ' || c == '\t' || c == '\n' || c == '\f' || c == '#') {
			if (c == '#') {
				// kill comment
				while (c >= 0 && c != '\n') {
					read();
				}
			} else {
				read();
			}
		}
		text.setLength(0);
		tokenLine = lineNumber;
		if (c < 0) {
			token = Token.EOF;
			return token;
		}

		switch (c) {
		case ':':
			read();
			token = Token.COLON;
			return token;
		case ',':
			read();
			token = Token.COMMA;
			return token;
		case '{':
			read();
			token = Token.OPEN_BRACE;
			return token;
		case '}':
			read();
			token = Token.CLOSE_BRACE;
			return token;
		case '(':
			read();
			token = Token.OPEN_PAREN;
			return token;
		case ')':
			read();
			token = Token.CLOSE_PAREN;
			return token;
		case '[':
			read();
			token = Token.OPEN_BRACKET;
			return token;
		case ']':
			read();
			token = Token.CLOSE_BRACKET;
			return token;
		case '-':
			read();
			token = Token.DASH;
			return token;
		case '/':
			read();
			token = Token.SLASH;
			return token;
		case '"':
		case '\'':
			readString();
			token = Token.DQUOTEDSTRING;
			return token;
		default:
			break;
		}

		if (Character.isDigit(c)) {
			if (c == '0') {
				read();
				if (c == 'x') {
					read();
					if (Character.digit(c, 16) < 0) {
						throw lexerException("Expecting hexadecimal digits after " + text);
					}
					while (Character.digit(c, 16) >= 0) {
						read();
					}
					token = Token.HEX;
					return token;
				}
			}
			while (Character.isDigit(c)) {
				read();
			}
			token = Token.INTEGER;
			return token;
		}

		if (isWordStart(c)) {
			read();
			while (isWordPart(c)) {
				read();
			}
			String word = text.toString();
			Token kwToken = KEYWORDS.get(word);
			if (kwToken != null) {
				token = kwToken;
				return token;
			}
			VarType.Kind kind = ATTRIBUTES.get(word);
			if (kind != null) {
				attribute = kind;
				token = Token.ATTRIBUTE;
				return token;
			}
			if (DSCP_RANGE.matcher(word).matches()) {
				token = Token.DSCP_RANGE;
				return token;
			}
			if (DSCP.matcher(word).matches()) {
				token = Token.DSCP;
				return token;
			}
			token = Token.STRING;
			return token;
		}

		throw lexerException("Illegal character '" + (char) c + "' on line " + lineNumber);
	}

	// SUPPORTING FUNCTIONS/METHODS

	/**
	 * Whether the current token can be used as a plain value.
	 */
	private boolean isWord() {
		return token == Token.STRING
				|| token == Token.INTEGER
				|| token == Token.HEX
				|| token == Token.DSCP
				|| token == Token.DSCP_RANGE;
	}

	private static List<VarType> toVarTypes(VarType.Kind kind, List<String> values) {
		List<VarType> result = new ArrayList<VarType>();
		for (String value : values) {
			result.add(new VarType(kind, value));
		}
		return result;
	}

	private void validateFlexibleMatch(String key, String value, int line) {
		if (!FLEXIBLE_MATCH_ATTRIBUTES.contains(key)) {
			throw new FlexibleMatchException(key + " is not a valid flexible match attribute", context.getFilename(), line);
		}
		if ("match-start".equals(key) && !FLEXIBLE_MATCH_START.contains(value)) {
			throw new FlexibleMatchException(
					value + " is not a valid match-start value, expecting one of " + FLEXIBLE_MATCH_START,
					context.getFilename(),
					line);
		}
		Integer max = FLEXIBLE_MATCH_LIMITS.get(key);
		if (max != null) {
			int number;
			try {
				number = Integer.decode(value);
			} catch (NumberFormatException e) {
				throw new FlexibleMatchException(key + " value " + value + " is not a number", context.getFilename(), line);
			}
			if (number < 0 || number > max) {
				throw new FlexibleMatchException(
						key + " value " + value + " is out of range [0, " + max + "]",
						context.getFilename(),
						line);
			}
		}
	}

	// RECURSIVE DESCENT PARSER:
	// CHECKSTYLE.OFF: MethodName
	// POLICY : [FILTER]* Token.EOF
	Policy POLICY() throws IOException {
		Policy policy = new Policy(context.getFilename());
		while (token == Token.KW_HEADER) {
			FILTER(policy);
		}
		if (token != Token.EOF) {
			throw parserException("Expecting header. Found: " + token.name() + " (" + text + ")");
		}
		if (policy.getFilters().isEmpty()) {
			throw new NoTermsException("There are no filters in policy " + context.getFilename());
		}
		return policy;
	}

	// FILTER : HEADER TERMS
	void FILTER(Policy policy) throws IOException {
		Header header = HEADER();
		List<Term> terms = TERMS();
		policy.addFilter(header, terms);
		LOG.debug("Parsed filter {} with {} term(s)", header.getPlatforms(), terms.size());
	}

	// HEADER : header '{' [HEADER_SPEC]* '}'
	Header HEADER() throws IOException {
		lexer(Token.KW_HEADER);
		lexer(Token.OPEN_BRACE);
		Header header = new Header();
		while (token == Token.ATTRIBUTE) {
			HEADER_SPEC(header);
		}
		lexer(Token.CLOSE_BRACE);
		return header;
	}

	// HEADER_SPEC : ( target | comment | apply-groups | apply-groups-except ) ATTRIBUTE_START VALUE
	void HEADER_SPEC(Header header) throws IOException {
		VarType.Kind kind = attribute;
		switch (kind) {
		case TARGET:
			ATTRIBUTE_START();
			List<String> words = WORD_LIST();
			if (words.isEmpty()) {
				throw parserException("Expecting a target platform. Found: " + token.name() + " (" + text + ")");
			}
			header.addObject(new Target(words.get(0), words.subList(1, words.size())));
			break;
		case COMMENT:
			ATTRIBUTE_START();
			header.addObject(new VarType(kind, QUOTED_STRING()));
			break;
		case APPLY_GROUPS:
		case APPLY_GROUPS_EXCEPT:
			ATTRIBUTE_START();
			header.addObject(toVarTypes(kind, WORD_LIST()));
			break;
		default:
			throw parserException("Not a header attribute: " + text);
		}
	}

	// TERMS : [TERM]*
	List<Term> TERMS() throws IOException {
		List<Term> terms = new ArrayList<Term>();
		while (token == Token.KW_TERM) {
			terms.add(TERM());
		}
		return terms;
	}

	// TERM : term WORD '{' [TERM_SPEC]* '}'
	Term TERM() throws IOException {
		lexer(Token.KW_TERM);
		String name = WORD();
		lexer(Token.OPEN_BRACE);
		Term term = new Term();
		term.setName(name);
		while (token == Token.ATTRIBUTE) {
			TERM_SPEC(term);
		}
		lexer(Token.CLOSE_BRACE);
		return term;
	}

	// ATTRIBUTE_START : ATTRIBUTE ':' ':'
	void ATTRIBUTE_START() throws IOException {
		lexer(Token.ATTRIBUTE);
		lexer(Token.COLON);
		lexer(Token.COLON);
	}

	// TERM_SPEC : ATTRIBUTE_START VALUE, where the VALUE grammar depends on the attribute
	void TERM_SPEC(Term term) throws IOException {
		VarType.Kind kind = attribute;
		int line = tokenLine;
		Naming naming = context.getNaming();
		ATTRIBUTE_START();
		switch (kind) {
		case ACTION:
		case COUNTER:
		case DINTERFACE:
		case ENCAPSULATE:
		case FILTER_TERM:
		case LOGGING:
		case LOSS_PRIORITY:
		case NEXT_IP:
		case OWNER:
		case POLICER:
		case PORT_MIRROR:
		case QOS:
		case RESTRICT_ADDRESS_FAMILY:
		case ROUTING_INSTANCE:
		case SINTERFACE:
		case TRAFFIC_CLASS_COUNT:
			term.addObject(new VarType(kind, WORD()), naming);
			break;
		case ADDRESS:
		case ADDREXCLUDE:
		case APPLY_GROUPS:
		case APPLY_GROUPS_EXCEPT:
		case DADDRESS:
		case DADDREXCLUDE:
		case DPFX:
		case DPFX_EXCEPT:
		case DPORT:
		case DTAG:
		case DZONE:
		case ETHER_TYPE:
		case FORWARDING_CLASS:
		case FORWARDING_CLASS_EXCEPT:
		case ICMP_TYPE:
		case OPTION:
		case PAN_APPLICATION:
		case PLATFORM:
		case PLATFORMEXCLUDE:
		case PORT:
		case PROTOCOL:
		case PROTOCOL_EXCEPT:
		case SADDRESS:
		case SADDREXCLUDE:
		case SPFX:
		case SPFX_EXCEPT:
		case SPORT:
		case STAG:
		case SZONE:
		case TARGET:
		case TARGET_SERVICE_ACCOUNTS:
		case TRAFFIC_TYPE:
			term.addObject(toVarTypes(kind, WORD_LIST()), naming);
			break;
		case ICMP_CODE:
		case PRECEDENCE:
			for (Integer value : INTEGER_LIST()) {
				term.addObject(new VarType(kind, value), naming);
			}
			break;
		case PRIORITY:
		case TIMEOUT:
		case TTL:
			term.addObject(new VarType(kind, INTEGER()), naming);
			break;
		case FRAGMENT_OFFSET:
		case HOP_LIMIT:
		case PACKET_LEN:
			term.addObject(new VarType(kind, INTEGER_RANGE()), naming);
			break;
		case EXPIRATION:
			term.addObject(new VarType(kind, DATE(line)), naming);
			break;
		case COMMENT:
		case LOG_NAME:
			term.addObject(new VarType(kind, QUOTED_STRING()), naming);
			break;
		case VERBATIM:
			String platform = WORD();
			term.addObject(new VarType(kind, new Verbatim(platform, QUOTED_STRING())), naming);
			break;
		case VPN:
			String vpnName = WORD();
			String pairPolicy = isWord() ? WORD() : "";
			term.addObject(new VarType(kind, new Vpn(vpnName, pairPolicy)), naming);
			break;
		case LOG_LIMIT:
			int rate = INTEGER();
			lexer(Token.SLASH);
			term.addObject(new VarType(kind, new LogLimit(rate, WORD())), naming);
			break;
		case DSCP_SET:
			if (token != Token.DSCP && token != Token.INTEGER) {
				throw parserException("Expecting a DSCP value. Found: " + token.name() + " (" + text + ")");
			}
			term.addObject(new VarType(kind, WORD()), naming);
			break;
		case DSCP_EXCEPT:
		case DSCP_MATCH:
			List<String> dscpValues = DSCP_LIST();
			if (dscpValues.isEmpty()) {
				throw parserException("Expecting a DSCP value or range. Found: " + token.name() + " (" + text + ")");
			}
			term.addObject(toVarTypes(kind, dscpValues), naming);
			break;
		case FLEXIBLE_MATCH_RANGE:
			FLEXIBLE_MATCH_RANGE(term, line);
			break;
		case TARGET_RESOURCES:
			for (Map.Entry<String, String> tuple : TUPLES()) {
				term.addObject(new VarType(kind, tuple), naming);
			}
			break;
		default:
			throw parserException("Unexpected attribute " + kind);
		}
	}

	// WORD : STRING | INTEGER | HEX | DSCP | DSCP_RANGE
	String WORD() throws IOException {
		if (!isWord()) {
			throw parserException("Expecting a value. Found: " + token.name() + " (" + text + ")");
		}
		String value = text.toString();
		lexer();
		return value;
	}

	// WORD_LIST : [WORD]*
	List<String> WORD_LIST() throws IOException {
		List<String> values = new ArrayList<String>();
		while (isWord()) {
			values.add(WORD());
		}
		return values;
	}

	// INTEGER : Token.INTEGER
	int INTEGER() throws IOException {
		String value = text.toString();
		lexer(Token.INTEGER);
		try {
			return Integer.parseInt(value);
		} catch (NumberFormatException e) {
			throw new ParserException("Integer out of range: " + value, context.getFilename(), tokenLine);
		}
	}

	// INTEGER_LIST : [INTEGER]*
	List<Integer> INTEGER_LIST() throws IOException {
		List<Integer> values = new ArrayList<Integer>();
		while (token == Token.INTEGER) {
			values.add(INTEGER());
		}
		return values;
	}

	// INTEGER_RANGE : INTEGER [ '-' INTEGER ]
	String INTEGER_RANGE() throws IOException {
		int line = tokenLine;
		int low = INTEGER();
		if (token != Token.DASH) {
			return Integer.toString(low);
		}
		lexer();
		int high = INTEGER();
		if (low > high) {
			throw new ParserException(
					"Invalid range " + low + "-" + high + ", the low bound exceeds the high bound",
					context.getFilename(),
					line);
		}
		return low + "-" + high;
	}

	// DATE : INTEGER '-' INTEGER '-' INTEGER
	LocalDate DATE(int line) throws IOException {
		int year = INTEGER();
		lexer(Token.DASH);
		int month = INTEGER();
		lexer(Token.DASH);
		int day = INTEGER();
		try {
			return LocalDate.of(year, month, day);
		} catch (DateTimeException e) {
			throw new ParserException(
					"Invalid expiration date " + year + "-" + month + "-" + day + ": " + e.getMessage(),
					context.getFilename(),
					line);
		}
	}

	// QUOTED_STRING : DQUOTEDSTRING
	String QUOTED_STRING() throws IOException {
		String value = string.toString();
		lexer(Token.DQUOTEDSTRING);
		return value;
	}

	// DSCP_LIST : [ DSCP | DSCP_RANGE | INTEGER ]*
	List<String> DSCP_LIST() throws IOException {
		List<String> values = new ArrayList<String>();
		while (token == Token.DSCP || token == Token.DSCP_RANGE || token == Token.INTEGER) {
			values.add(WORD());
		}
		return values;
	}

	// FLEXIBLE_MATCH_RANGE : [ STRING WORD ]*
	void FLEXIBLE_MATCH_RANGE(Term term, int line) throws IOException {
		while (token == Token.STRING) {
			String key = WORD();
			String value = WORD();
			validateFlexibleMatch(key, value, line);
			term.addObject(
					new VarType(VarType.Kind.FLEXIBLE_MATCH_RANGE, new AbstractMap.SimpleImmutableEntry<String, String>(key, value)),
					context.getNaming());
		}
	}

	// TUPLES : '[' TUPLES ']' | [ TUPLE [','] ]*
	List<Map.Entry<String, String>> TUPLES() throws IOException {
		List<Map.Entry<String, String>> tuples = new ArrayList<Map.Entry<String, String>>();
		if (token == Token.OPEN_BRACKET) {
			lexer();
			tuples.addAll(TUPLES());
			lexer(Token.CLOSE_BRACKET);
			return tuples;
		}
		while (token == Token.OPEN_PAREN) {
			tuples.add(TUPLE());
			if (token == Token.COMMA) {
				lexer();
			}
		}
		return tuples;
	}

	// TUPLE : '(' WORD ',' WORD ')'
	Map.Entry<String, String> TUPLE() throws IOException {
		lexer(Token.OPEN_PAREN);
		String first = WORD();
		lexer(Token.COMMA);
		String second = WORD();
		lexer(Token.CLOSE_PAREN);
		return new AbstractMap.SimpleImmutableEntry<String, String>(first, second);
	}
	// CHECKSTYLE.ON: MethodName
}
