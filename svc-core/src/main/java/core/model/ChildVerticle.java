package core.model;

/**
 * A deployed child verticle, kept so it can be undeployed on shutdown.
 */
public record ChildVerticle( String vertName, String id )
{
}
