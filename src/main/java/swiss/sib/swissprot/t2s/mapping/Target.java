package swiss.sib.swissprot.t2s.mapping;

/**
 * Where generated statements should be written to.
 */
public record Target(String name, String access, String type, String serialization, String compression) {

}
