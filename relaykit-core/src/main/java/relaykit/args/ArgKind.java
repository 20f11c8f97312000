package relaykit.args;

/**
 * The value kinds an {@link Arguments} bundle can carry.
 */
public enum ArgKind {
  STRING,
  INT,
  LONG,
  FLOAT,
  DOUBLE,
  BOOLEAN,
  BYTE_ARRAY,
  CHAR_ARRAY,
  BOOLEAN_ARRAY,
  INT_ARRAY,
  LONG_ARRAY,
  FLOAT_ARRAY,
  DOUBLE_ARRAY,
  STRING_LIST,
  SERIALIZABLE
}
