package com.github.henkexbg.wordlestrategy;

/**
 * Thrown when a token cannot be turned into a {@link Word}, i.e. it is not
 * exactly {@link Word#LENGTH} lowercase letters a-z.
 *
 * @author Henrik Bjerne
 *
 */
public class WordFormatException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	private final String token;

	public WordFormatException(String token, String reason) {
		super(String.format("Not a valid word: '%s' (%s)", token, reason));
		this.token = token;
	}

	public String getToken() {
		return token;
	}

}
