package store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import core.exceptions.StorageException;
import model.IdentityKey;
import model.KeyWriteBatch;
import model.OneTimePreKey;
import model.SignedPreKey;
import support.Await;
import support.TestKeys;

public class InMemoryKeyStoreTest
{
  private static final Instant T0 = Instant.parse( "2026-01-01T00:00:00Z" );

  private InMemoryKeyStore store;
  private UUID             alice;

  @BeforeEach
  public void setUp()
  {
    store = new InMemoryKeyStore();
    alice = UUID.randomUUID();
  }

  private static List<OneTimePreKey> oneTimeKeys( UUID userId, Instant createdAt, int... keyIds )
  {
    List<OneTimePreKey> keys = new ArrayList<>();
    for( int keyId : keyIds )
    {
      keys.add( new OneTimePreKey( keyId, userId, TestKeys.agreementKey(), false, createdAt ) );
    }
    return keys;
  }

  private static SignedPreKey signedPreKey( UUID userId, int keyId, Instant createdAt )
  {
    return new SignedPreKey( keyId, userId, TestKeys.agreementKey(), new byte[ 64 ], createdAt );
  }

  @Test
  public void unknownUserHasNothing()
   throws Exception
  {
    assertNull( Await.result( store.findIdentityKey( alice ) ) );
    assertNull( Await.result( store.findLatestSignedPreKey( alice ) ) );
    assertNull( Await.result( store.claimOneTimePreKey( alice ) ) );
    assertEquals( 0, Await.result( store.countUnusedOneTimePreKeys( alice ) ) );
  }

  @Test
  public void writeStoresEveryPartOfTheBatch()
   throws Exception
  {
    IdentityKey identity = new IdentityKey( alice, new byte[ 32 ], T0 );
    int inserted = Await.result( store.write( new KeyWriteBatch( alice, identity, signedPreKey( alice, 1, T0 ), oneTimeKeys( alice, T0, 1, 2, 3 ) ) ) );

    assertEquals( 3, inserted );
    assertEquals( identity, Await.result( store.findIdentityKey( alice ) ) );
    assertEquals( 1, Await.result( store.findLatestSignedPreKey( alice ) ).getKeyId() );
    assertEquals( 3, Await.result( store.countUnusedOneTimePreKeys( alice ) ) );
  }

  @Test
  public void duplicateOneTimeKeyIdsAreSkipped()
   throws Exception
  {
    Await.result( store.write( new KeyWriteBatch( alice, null, null, oneTimeKeys( alice, T0, 1, 2 ) ) ) );
    Await.result( store.claimOneTimePreKey( alice ) );

    int inserted = Await.result( store.write( new KeyWriteBatch( alice, null, null, oneTimeKeys( alice, T0, 1, 2, 3 ) ) ) );

    // key 1 was claimed; re-uploading it must not make it claimable again
    assertEquals( 1, inserted );
    assertEquals( 2, Await.result( store.countUnusedOneTimePreKeys( alice ) ) );
  }

  @Test
  public void claimsOldestKeyFirstAndNeverTwice()
   throws Exception
  {
    Await.result( store.write( new KeyWriteBatch( alice, null, null, oneTimeKeys( alice, T0.plusSeconds( 10 ), 5 ) ) ) );
    Await.result( store.write( new KeyWriteBatch( alice, null, null, oneTimeKeys( alice, T0, 9, 7 ) ) ) );

    assertEquals( 7, Await.result( store.claimOneTimePreKey( alice ) ).getKeyId() );
    assertEquals( 9, Await.result( store.claimOneTimePreKey( alice ) ).getKeyId() );

    OneTimePreKey last = Await.result( store.claimOneTimePreKey( alice ) );
    assertEquals( 5, last.getKeyId() );
    assertTrue( last.isUsed() );

    assertNull( Await.result( store.claimOneTimePreKey( alice ) ) );
  }

  @Test
  public void latestSignedPreKeyIsTheNewest()
   throws Exception
  {
    Await.result( store.write( new KeyWriteBatch( alice, null, signedPreKey( alice, 1, T0 ), null ) ) );
    Await.result( store.write( new KeyWriteBatch( alice, null, signedPreKey( alice, 2, T0.plus( Duration.ofDays( 7 ) ) ), null ) ) );

    assertEquals( 2, Await.result( store.findLatestSignedPreKey( alice ) ).getKeyId() );
  }

  @Test
  public void failureMidBatchLeavesNothingBehind()
   throws Exception
  {
    InMemoryKeyStore failing = new InMemoryKeyStore()
    {
      @Override
      protected void stageOneTimePreKey( Map<Integer, OneTimePreKey> staged, OneTimePreKey key )
      {
        if( key.getKeyId() == 3 )
        {
          throw new IllegalStateException( "connection reset" );
        }
        super.stageOneTimePreKey( staged, key );
      }
    };

    Throwable err = Await.failure( failing.write( new KeyWriteBatch( alice,
                                                                     new IdentityKey( alice, new byte[ 32 ], T0 ),
                                                                     signedPreKey( alice, 1, T0 ),
                                                                     oneTimeKeys( alice, T0, 1, 2, 3, 4 ) ) ) );

    assertInstanceOf( StorageException.class, err );
    assertNull( Await.result( failing.findIdentityKey( alice ) ) );
    assertNull( Await.result( failing.findLatestSignedPreKey( alice ) ) );
    assertEquals( 0, Await.result( failing.countUnusedOneTimePreKeys( alice ) ) );
  }

  @Test
  public void concurrentClaimsReturnDistinctKeys()
   throws Exception
  {
    int keys    = 50;
    int callers = 80;

    int[] keyIds = new int[ keys ];
    for( int i = 0; i < keys; i++ )
    {
      keyIds[ i ] = i;
    }
    Await.result( store.write( new KeyWriteBatch( alice, null, null, oneTimeKeys( alice, T0, keyIds ) ) ) );

    ExecutorService pool = Executors.newFixedThreadPool( 16 );
    try
    {
      List<Callable<OneTimePreKey>> claims = new ArrayList<>();
      for( int i = 0; i < callers; i++ )
      {
        claims.add( () -> Await.result( store.claimOneTimePreKey( alice ) ) );
      }

      Set<Integer> claimed   = Collections.synchronizedSet( new HashSet<>() );
      int          exhausted = 0;
      for( java.util.concurrent.Future<OneTimePreKey> f : pool.invokeAll( claims ) )
      {
        OneTimePreKey key = f.get();
        if( key == null )
        {
          exhausted++;
        }
        else
        {
          assertTrue( claimed.add( key.getKeyId() ), "key " + key.getKeyId() + " claimed twice" );
        }
      }

      assertEquals( keys, claimed.size() );
      assertEquals( callers - keys, exhausted );
    }
    finally
    {
      pool.shutdown();
      pool.awaitTermination( 5, TimeUnit.SECONDS );
    }
  }

  @Test
  public void closeDropsState()
   throws Exception
  {
    Await.result( store.write( new KeyWriteBatch( alice, new IdentityKey( alice, new byte[ 32 ], T0 ), null, null ) ) );
    assertNotNull( Await.result( store.findIdentityKey( alice ) ) );

    Await.result( store.close() );
    assertNull( Await.result( store.findIdentityKey( alice ) ) );
  }
}
