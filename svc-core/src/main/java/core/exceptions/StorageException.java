package core.exceptions;

/**
 * Transient failure of the backing store (timeout, lost connection, aborted
 * transaction). Nothing of the failed call is committed; the caller decides
 * whether to retry.
 */
public class StorageException extends Exception
{
  private static final long serialVersionUID = 4757156132833816243L;

  public StorageException( String msg )
  {
    super( msg );
  }

  public StorageException( String msg, Throwable cause )
  {
    super( msg, cause );
  }
}
