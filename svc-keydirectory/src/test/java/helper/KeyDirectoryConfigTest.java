package helper;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

import org.junit.jupiter.api.Test;

import core.nats.NatsClient;

public class KeyDirectoryConfigTest
{
  private static String resource( String name )
   throws Exception
  {
    try( InputStream in = KeyDirectoryConfigTest.class.getResourceAsStream( name ) )
    {
      return new String( in.readAllBytes(), StandardCharsets.UTF_8 );
    }
  }

  @Test
  public void emptyDocumentGetsDefaults()
   throws Exception
  {
    KeyDirectoryConfig config = KeyDirectoryConfig.fromJson( "{}" );
    config.validate();

    assertEquals( "keydirectory", config.getServiceId() );
    assertEquals( 20,   config.getKeys().getReplenishThreshold() );
    assertEquals( 100,  config.getKeys().getMaxOneTimeKeysPerUpload() );
    assertEquals( 5000, config.getKeys().getTransactionTimeoutMs() );
    assertEquals( Duration.ofDays( 7 ), config.getKeys().getSignedPreKeyMaxAge() );
    assertEquals( KeyDirectoryConfig.StorePostgres, config.getKeys().getStoreType() );
    assertEquals( 5432, config.getPostgres().getPort() );
    assertTrue( config.getNats().isEnabled() );
  }

  @Test
  public void partialSectionsKeepRemainingDefaults()
   throws Exception
  {
    KeyDirectoryConfig config = KeyDirectoryConfig.fromJson( resource( "/keyDirectoryConfig-test.json" ) );
    config.validate();

    assertEquals( "keydirectory-test", config.getServiceId() );
    assertEquals( 5, config.getKeys().getReplenishThreshold() );
    assertEquals( 100, config.getKeys().getMaxOneTimeKeysPerUpload() );
    assertEquals( KeyDirectoryConfig.StoreMemory, config.getKeys().getStoreType() );
    assertFalse( config.getNats().isEnabled() );
  }

  @Test
  public void shippedSampleIsValid()
   throws Exception
  {
    KeyDirectoryConfig config = KeyDirectoryConfig.fromJson( resource( "/keyDirectoryConfig.json" ) );
    config.validate();

    assertEquals( 26257, config.getPostgres().getPort() );
    assertTrue( config.getNats().isNatsUseTLS() );
  }

  @Test
  public void natsSettingsMapOntoClientKeys()
   throws Exception
  {
    KeyDirectoryConfig config = KeyDirectoryConfig.fromJson(
      "{\"nats\":{\"natsUrls\":\"nats://a:4222,nats://b:4222\",\"natsUseTLS\":false,\"natsCaCertPath\":\"/ca.crt\"}}" );

    Map<String, String> clientConfig = config.getNats().toClientConfig();

    assertEquals( "nats://a:4222,nats://b:4222", clientConfig.get( NatsClient.NATS_URLS ) );
    assertEquals( "false", clientConfig.get( NatsClient.NATS_USE_TLS ) );
    assertNull( clientConfig.get( NatsClient.NATS_CA_CERT_PATH ) );
  }

  @Test
  public void rejectsUnusableValues()
   throws Exception
  {
    assertThrows( IllegalArgumentException.class, () -> KeyDirectoryConfig.fromJson( "{\"keys\":{\"storeType\":\"redis\"}}" ).validate() );
    assertThrows( IllegalArgumentException.class, () -> KeyDirectoryConfig.fromJson( "{\"keys\":{\"maxOneTimeKeysPerUpload\":0}}" ).validate() );
    assertThrows( IllegalArgumentException.class, () -> KeyDirectoryConfig.fromJson( "{\"keys\":{\"transactionTimeoutMs\":-1}}" ).validate() );
  }
}
