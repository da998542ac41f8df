package helper;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.File;
import java.io.IOException;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import core.model.ServiceCoreIF;
import core.nats.NatsClient;

/**
 * Contents of keyDirectoryConfig.json. Every value has a default, so a
 * missing section or field falls back rather than failing.
 */
@JsonIgnoreProperties( ignoreUnknown = true )
public class KeyDirectoryConfig
{
  public static final String StorePostgres = "postgres";
  public static final String StoreMemory   = "memory";

  @JsonProperty( "serviceId" ) private String serviceId = ServiceCoreIF.KeyDirectorySvcId;

  @JsonProperty( "nats"     ) private NatsConfig     nats     = new NatsConfig();
  @JsonProperty( "postgres" ) private PostgresConfig postgres = new PostgresConfig();
  @JsonProperty( "keys"     ) private KeysConfig     keys     = new KeysConfig();

  public String         getServiceId() { return serviceId; }
  public NatsConfig     getNats()      { return nats;      }
  public PostgresConfig getPostgres()  { return postgres;  }
  public KeysConfig     getKeys()      { return keys;      }

  public static KeyDirectoryConfig fromFile( String path )
   throws IOException
  {
    ObjectMapper mapper = new ObjectMapper();
    return mapper.readValue( new File( path ), KeyDirectoryConfig.class );
  }

  public static KeyDirectoryConfig fromJson( String json )
   throws IOException
  {
    ObjectMapper mapper = new ObjectMapper();
    return mapper.readValue( json, KeyDirectoryConfig.class );
  }

  /**
   * Checks ranges that defaults cannot repair.
   *
   * @throws IllegalArgumentException naming the first bad value
   */
  public void validate()
  {
    if( keys.getReplenishThreshold() < 0 )
    {
      throw new IllegalArgumentException( "keys.replenishThreshold must not be negative" );
    }
    if( keys.getMaxOneTimeKeysPerUpload() <= 0 )
    {
      throw new IllegalArgumentException( "keys.maxOneTimeKeysPerUpload must be positive" );
    }
    if( keys.getTransactionTimeoutMs() <= 0 )
    {
      throw new IllegalArgumentException( "keys.transactionTimeoutMs must be positive" );
    }
    if( keys.getSignedPreKeyMaxAgeDays() <= 0 )
    {
      throw new IllegalArgumentException( "keys.signedPreKeyMaxAgeDays must be positive" );
    }
    if( !StorePostgres.equals( keys.getStoreType() ) && !StoreMemory.equals( keys.getStoreType() ) )
    {
      throw new IllegalArgumentException( "keys.storeType must be '" + StorePostgres + "' or '" + StoreMemory + "', got " + keys.getStoreType() );
    }
  }

  // Nested Classes
  @JsonIgnoreProperties( ignoreUnknown = true )
  public static class NatsConfig
  {
    @JsonProperty( "enabled"            ) private boolean enabled            = true;
    @JsonProperty( "natsUrls"           ) private String  natsUrls           = "nats://localhost:4222";
    @JsonProperty( "natsUseTLS"         ) private boolean natsUseTLS         = false;
    @JsonProperty( "natsCaCertPath"     ) private String  natsCaCertPath;
    @JsonProperty( "natsClientCertPath" ) private String  natsClientCertPath;
    @JsonProperty( "natsClientKeyPath"  ) private String  natsClientKeyPath;

    public boolean isEnabled()             { return enabled;            }
    public String  getNatsUrls()           { return natsUrls;           }
    public boolean isNatsUseTLS()          { return natsUseTLS;         }
    public String  getNatsCaCertPath()     { return natsCaCertPath;     }
    public String  getNatsClientCertPath() { return natsClientCertPath; }
    public String  getNatsClientKeyPath()  { return natsClientKeyPath;  }

    /**
     * @return the connection settings keyed the way NatsClient reads them
     */
    public Map<String, String> toClientConfig()
    {
      Map<String, String> natsConfig = new HashMap<>();

      natsConfig.put( NatsClient.NATS_URLS,    natsUrls );
      natsConfig.put( NatsClient.NATS_USE_TLS, Boolean.toString( natsUseTLS ) );
      if( natsUseTLS )
      {
        natsConfig.put( NatsClient.NATS_CA_CERT_PATH,     natsCaCertPath     );
        natsConfig.put( NatsClient.NATS_CLIENT_CERT_PATH, natsClientCertPath );
        natsConfig.put( NatsClient.NATS_CLIENT_KEY_PATH,  natsClientKeyPath  );
      }

      return natsConfig;
    }
  }

  @JsonIgnoreProperties( ignoreUnknown = true )
  public static class PostgresConfig
  {
    @JsonProperty( "host"       ) private String  host       = "localhost";
    @JsonProperty( "port"       ) private int     port       = 5432;
    @JsonProperty( "database"   ) private String  database   = "keydirectory";
    @JsonProperty( "user"       ) private String  user       = "keydirectory";
    @JsonProperty( "password"   ) private String  password   = "";
    @JsonProperty( "poolSize"   ) private int     poolSize   = 10;
    @JsonProperty( "initSchema" ) private boolean initSchema = true;

    public String  getHost()       { return host;       }
    public int     getPort()       { return port;       }
    public String  getDatabase()   { return database;   }
    public String  getUser()       { return user;       }
    public String  getPassword()   { return password;   }
    public int     getPoolSize()   { return poolSize;   }
    public boolean isInitSchema()  { return initSchema; }
  }

  @JsonIgnoreProperties( ignoreUnknown = true )
  public static class KeysConfig
  {
    @JsonProperty( "replenishThreshold"      ) private int    replenishThreshold      = 20;
    @JsonProperty( "maxOneTimeKeysPerUpload" ) private int    maxOneTimeKeysPerUpload = 100;
    @JsonProperty( "transactionTimeoutMs"    ) private long   transactionTimeoutMs    = 5000;
    @JsonProperty( "signedPreKeyMaxAgeDays"  ) private int    signedPreKeyMaxAgeDays  = 7;
    @JsonProperty( "storeType"               ) private String storeType               = StorePostgres;

    public int    getReplenishThreshold()      { return replenishThreshold;      }
    public int    getMaxOneTimeKeysPerUpload() { return maxOneTimeKeysPerUpload; }
    public long   getTransactionTimeoutMs()    { return transactionTimeoutMs;    }
    public int    getSignedPreKeyMaxAgeDays()  { return signedPreKeyMaxAgeDays;  }
    public String getStoreType()               { return storeType;               }

    public Duration getSignedPreKeyMaxAge()
    {
      return Duration.ofDays( signedPreKeyMaxAgeDays );
    }
  }
}
