package core.utils;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import core.exceptions.KeyValidationException;

public class B64HandlerTest
{
  @Test
  public void decodesPaddedStandardBase64()
   throws Exception
  {
    byte[] decoded = B64Handler.decodeBytes( "identity_key", "AQIDBA==" );

    assertArrayEquals( new byte[] { 1, 2, 3, 4 }, decoded );
    assertEquals( "AQIDBA==", B64Handler.encodeBytes( decoded ) );
  }

  @Test
  public void missingValueNamesTheField()
  {
    KeyValidationException e = assertThrows( KeyValidationException.class, () -> B64Handler.decodeBytes( "signed_pre_key.signature", null ) );

    assertEquals( "signed_pre_key.signature", e.getField() );
    assertThrows( KeyValidationException.class, () -> B64Handler.decodeBytes( "identity_key", "" ) );
  }

  @Test
  public void rejectsNonBase64Text()
  {
    KeyValidationException e = assertThrows( KeyValidationException.class, () -> B64Handler.decodeBytes( "public_key", "not*base64!" ) );

    assertEquals( "public_key", e.getField() );
    assertTrue( e.getMessage().contains( "not valid base64" ) );
  }

  @Test
  public void rejectsUrlSafeAlphabet()
  {
    // '-' and '_' belong to the URL-safe alphabet only
    assertThrows( KeyValidationException.class, () -> B64Handler.decodeBytes( "public_key", "-_-_" ) );
  }

  @Test
  public void encodeOfNullIsNull()
  {
    assertNull( B64Handler.encodeBytes( null ) );
  }
}
