package store;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.pgclient.PgException;
import io.vertx.sqlclient.Pool;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.RowSet;
import io.vertx.sqlclient.SqlConnection;
import io.vertx.sqlclient.Tuple;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import core.exceptions.StorageException;
import model.IdentityKey;
import model.KeyWriteBatch;
import model.OneTimePreKey;
import model.SignedPreKey;

/**
 * Key store on PostgreSQL / CockroachDB through the Vert.x reactive client.
 *
 * Every call runs in its own transaction. {@code statement_timeout} cuts off
 * any single statement that runs past the timeout, and a transaction whose
 * statements together outlast it is rolled back instead of committed. An
 * expired or failed transaction surfaces as {@link StorageException}. One-time pre-keys are claimed with
 * {@code FOR UPDATE SKIP LOCKED} so concurrent claims lock disjoint rows.
 */
public class PgKeyStore implements KeyStoreIF
{
  private static final Logger LOGGER = LoggerFactory.getLogger( PgKeyStore.class );

  private static final String SchemaResource = "/schema/keydirectory.sql";
  private static final String QueryCanceled  = "57014";

  private static final String UpsertIdentityKey =
    "INSERT INTO identity_keys (user_id, public_key, created_at) VALUES ($1, $2, $3) " +
    "ON CONFLICT (user_id) DO UPDATE SET public_key = EXCLUDED.public_key, created_at = EXCLUDED.created_at";

  private static final String UpsertSignedPreKey =
    "INSERT INTO signed_pre_keys (user_id, key_id, public_key, signature, created_at) VALUES ($1, $2, $3, $4, $5) " +
    "ON CONFLICT (user_id, key_id) DO UPDATE SET public_key = EXCLUDED.public_key, signature = EXCLUDED.signature, created_at = EXCLUDED.created_at";

  private static final String InsertOneTimePreKey =
    "INSERT INTO one_time_pre_keys (user_id, key_id, public_key, used, created_at) VALUES ($1, $2, $3, FALSE, $4) " +
    "ON CONFLICT (user_id, key_id) DO NOTHING";

  private static final String SelectIdentityKey =
    "SELECT public_key, created_at FROM identity_keys WHERE user_id = $1";

  private static final String SelectLatestSignedPreKey =
    "SELECT key_id, public_key, signature, created_at FROM signed_pre_keys WHERE user_id = $1 " +
    "ORDER BY created_at DESC, key_id DESC LIMIT 1";

  private static final String SelectClaimableOneTimePreKey =
    "SELECT key_id, public_key, created_at FROM one_time_pre_keys WHERE user_id = $1 AND used = FALSE " +
    "ORDER BY created_at, key_id LIMIT 1 FOR UPDATE SKIP LOCKED";

  private static final String MarkOneTimePreKeyUsed =
    "UPDATE one_time_pre_keys SET used = TRUE WHERE user_id = $1 AND key_id = $2 AND used = FALSE";

  private static final String CountUnusedOneTimePreKeys =
    "SELECT COUNT(*) AS remaining FROM one_time_pre_keys WHERE user_id = $1 AND used = FALSE";

  private final Vertx vertx;
  private final Pool  pool;
  private final long  transactionTimeoutMs;
  private final Clock clock;

  public PgKeyStore( Vertx vertx, Pool pool, long transactionTimeoutMs )
  {
    this( vertx, pool, transactionTimeoutMs, Clock.systemUTC() );
  }

  public PgKeyStore( Vertx vertx, Pool pool, long transactionTimeoutMs, Clock clock )
  {
    this.vertx                = vertx;
    this.pool                 = pool;
    this.transactionTimeoutMs = transactionTimeoutMs;
    this.clock                = clock;
  }

  /**
   * Creates the key tables if they do not exist.
   */
  public Future<Void> initSchema()
  {
    return vertx.<String>executeBlocking( () ->
    {
      try( InputStream in = PgKeyStore.class.getResourceAsStream( SchemaResource ) )
      {
        if( in == null )
        {
          throw new IllegalStateException( "Schema resource not found: " + SchemaResource );
        }
        return new String( in.readAllBytes(), StandardCharsets.UTF_8 );
      }
    })
    .compose( ddl -> pool.query( ddl ).execute() )
    .onSuccess( rs -> LOGGER.info( "Key directory schema verified" ) )
    .recover( err -> Future.failedFuture( storageError( "initialize schema", err ) ) )
    .mapEmpty();
  }

  @Override
  public Future<Integer> write( KeyWriteBatch batch )
  {
    UUID userId = batch.getUserId();

    return inTransaction( "store keys for user " + userId, conn ->
      upsertIdentityKey( conn, batch.getIdentityKey() )
        .compose( v -> upsertSignedPreKey( conn, batch.getSignedPreKey() ) )
        .compose( v -> insertOneTimePreKeys( conn, userId, batch.getOneTimePreKeys() ) ) )
      .onSuccess( inserted -> LOGGER.debug( "Stored {} ({} new one-time pre-keys)", batch, inserted ) );
  }

  private Future<Void> upsertIdentityKey( SqlConnection conn, IdentityKey key )
  {
    if( key == null )
    {
      return Future.succeededFuture();
    }

    return conn.preparedQuery( UpsertIdentityKey )
               .execute( Tuple.of( key.getUserId(), Buffer.buffer( key.getPublicKey() ), toTimestamp( key.getCreatedAt() ) ) )
               .mapEmpty();
  }

  private Future<Void> upsertSignedPreKey( SqlConnection conn, SignedPreKey key )
  {
    if( key == null )
    {
      return Future.succeededFuture();
    }

    return conn.preparedQuery( UpsertSignedPreKey )
               .execute( Tuple.of( key.getUserId(),
                                   key.getKeyId(),
                                   Buffer.buffer( key.getPublicKey() ),
                                   Buffer.buffer( key.getSignature() ),
                                   toTimestamp( key.getCreatedAt() ) ) )
               .mapEmpty();
  }

  private Future<Integer> insertOneTimePreKeys( SqlConnection conn, UUID userId, List<OneTimePreKey> keys )
  {
    if( keys.isEmpty() )
    {
      return Future.succeededFuture( 0 );
    }

    List<Tuple> batch = new ArrayList<>( keys.size() );
    for( OneTimePreKey key : keys )
    {
      batch.add( Tuple.of( userId, key.getKeyId(), Buffer.buffer( key.getPublicKey() ), toTimestamp( key.getCreatedAt() ) ) );
    }

    return conn.preparedQuery( InsertOneTimePreKey )
               .executeBatch( batch )
               .map( rows ->
               {
                 // one result per tuple; conflicting ids report 0 rows
                 int inserted = 0;
                 for( RowSet<Row> rs = rows; rs != null; rs = rs.next() )
                 {
                   inserted += rs.rowCount();
                 }
                 return inserted;
               });
  }

  @Override
  public Future<IdentityKey> findIdentityKey( UUID userId )
  {
    return inTransaction( "read identity key of user " + userId, conn ->
      conn.preparedQuery( SelectIdentityKey )
          .execute( Tuple.of( userId ) )
          .<IdentityKey>map( rows ->
          {
            if( rows.size() == 0 )
            {
              return null;
            }
            Row row = rows.iterator().next();
            return new IdentityKey( userId, row.getBuffer( "public_key" ).getBytes(), fromTimestamp( row.getOffsetDateTime( "created_at" ) ) );
          }) );
  }

  @Override
  public Future<SignedPreKey> findLatestSignedPreKey( UUID userId )
  {
    return inTransaction( "read signed pre-key of user " + userId, conn ->
      conn.preparedQuery( SelectLatestSignedPreKey )
          .execute( Tuple.of( userId ) )
          .<SignedPreKey>map( rows ->
          {
            if( rows.size() == 0 )
            {
              return null;
            }
            Row row = rows.iterator().next();
            return new SignedPreKey( row.getInteger( "key_id" ),
                                     userId,
                                     row.getBuffer( "public_key" ).getBytes(),
                                     row.getBuffer( "signature" ).getBytes(),
                                     fromTimestamp( row.getOffsetDateTime( "created_at" ) ) );
          }) );
  }

  @Override
  public Future<OneTimePreKey> claimOneTimePreKey( UUID userId )
  {
    return inTransaction( "claim one-time pre-key of user " + userId, conn ->
      conn.preparedQuery( SelectClaimableOneTimePreKey )
          .execute( Tuple.of( userId ) )
          .<OneTimePreKey>compose( rows ->
          {
            if( rows.size() == 0 )
            {
              return Future.succeededFuture( null );
            }

            Row           row     = rows.iterator().next();
            OneTimePreKey claimed = new OneTimePreKey( row.getInteger( "key_id" ),
                                                       userId,
                                                       row.getBuffer( "public_key" ).getBytes(),
                                                       true,
                                                       fromTimestamp( row.getOffsetDateTime( "created_at" ) ) );

            return conn.preparedQuery( MarkOneTimePreKeyUsed )
                       .execute( Tuple.of( userId, claimed.getKeyId() ) )
                       .<OneTimePreKey>compose( updated ->
                       {
                         // the row is locked by this transaction, so the update must hit it
                         if( updated.rowCount() != 1 )
                         {
                           return Future.failedFuture( new StorageException( "One-time pre-key " + claimed.getKeyId() + " of user " + userId + " changed while locked" ) );
                         }
                         return Future.succeededFuture( claimed );
                       });
          }) );
  }

  @Override
  public Future<Integer> countUnusedOneTimePreKeys( UUID userId )
  {
    return inTransaction( "count one-time pre-keys of user " + userId, conn ->
      conn.preparedQuery( CountUnusedOneTimePreKeys )
          .execute( Tuple.of( userId ) )
          .map( rows -> rows.iterator().next().getLong( "remaining" ).intValue() ) );
  }

  @Override
  public Future<Void> close()
  {
    return pool.close()
               .onSuccess( v -> LOGGER.info( "Key store pool closed" ) );
  }

  /**
   * Runs work in a transaction. Each statement is cut off after the configured
   * timeout; the deadline check before commit bounds the transaction as a
   * whole. Any failure rolls the transaction back.
   */
  private <T> Future<T> inTransaction( String operation, Function<SqlConnection, Future<T>> work )
  {
    long deadline = clock.millis() + transactionTimeoutMs;

    return pool.withTransaction( conn ->
      conn.query( "SET LOCAL statement_timeout = " + transactionTimeoutMs )
          .execute()
          .compose( v -> work.apply( conn ) )
          .<T>compose( result ->
          {
            if( clock.millis() > deadline )
            {
              LOGGER.warn( "Transaction exceeded {} ms, rolling back: {}", transactionTimeoutMs, operation );
              return Future.failedFuture( new StorageException( "Timed out: " + operation ) );
            }
            return Future.succeededFuture( result );
          }) )
      .recover( err -> Future.failedFuture( storageError( operation, err ) ) );
  }

  private StorageException storageError( String operation, Throwable err )
  {
    if( err instanceof StorageException )
    {
      return (StorageException)err;
    }

    if( err instanceof PgException && QueryCanceled.equals( ( (PgException)err ).getSqlState() ) )
    {
      LOGGER.warn( "Timed out after {} ms: {}", transactionTimeoutMs, operation );
      return new StorageException( "Timed out: " + operation, err );
    }

    LOGGER.error( "Failed to {}: {}", operation, err.getMessage() );
    return new StorageException( "Failed to " + operation, err );
  }

  private static OffsetDateTime toTimestamp( Instant instant )
  {
    return OffsetDateTime.ofInstant( instant, ZoneOffset.UTC );
  }

  private static Instant fromTimestamp( OffsetDateTime timestamp )
  {
    return timestamp.toInstant();
  }
}
