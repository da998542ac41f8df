package core.exceptions;

/**
 * Thrown when uploaded key material is malformed. Raised before any write.
 */
public class KeyValidationException extends Exception
{
  private static final long serialVersionUID = 2908990171511790800L;

  private final String field;

  public KeyValidationException( String field, String msg )
  {
    super( msg );
    this.field = field;
  }

  public String getField()
  {
    return field;
  }
}
