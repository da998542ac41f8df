package core.exceptions;

/**
 * Thrown when a user has not published the keys an operation depends on.
 */
public class NotFoundException extends Exception
{
  private static final long serialVersionUID = 4757120132833816243L;

  private final String userId;

  public NotFoundException( String userId, String msg )
  {
    super( msg );
    this.userId = userId;
  }

  public String getUserId()
  {
    return userId;
  }
}
