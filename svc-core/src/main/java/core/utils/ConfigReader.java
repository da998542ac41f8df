package core.utils;


import java.util.Map;

import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Reads service configuration documents out of Kubernetes ConfigMaps in the
 * pod's namespace.
 */
public class ConfigReader
{
  private static final Logger LOGGER = LoggerFactory.getLogger( ConfigReader.class );

  private final KubernetesClient kubeClient;
  private final String           nameSpace;

  public ConfigReader()
  {
    this.kubeClient = new KubernetesClientBuilder().build();
    this.nameSpace  = kubeClient.getNamespace();
  }

  /**
   * Resolves the ConfigMap name from the environment, falling back to the
   * service default.
   */
  public static String configMapName( String envVar, String defaultName )
  {
    String name = System.getenv( envVar );
    return ( name == null || name.isBlank() ) ? defaultName : name;
  }

  /**
   * Returns one data entry (usually a JSON document) of a ConfigMap.
   *
   * @throws IllegalStateException when the map or the entry does not exist
   */
  public String getRequiredValue( String configMapName, String key )
  {
    Map<String, String> data = getConfigProperties( configMapName );
    String              val  = data.get( key );

    if( val == null )
    {
      throw new IllegalStateException( key + " not found in config map " + configMapName );
    }

    LOGGER.debug( "Read {} from config map {}/{}", key, nameSpace, configMapName );
    return val;
  }

  public Map<String, String> getConfigProperties( String configMapName )
  {
    ConfigMap configMap = kubeClient.configMaps().inNamespace( nameSpace ).withName( configMapName ).get();

    if( configMap == null || configMap.getData() == null )
    {
      throw new IllegalStateException( "ConfigMap not found: " + nameSpace + "/" + configMapName );
    }

    return configMap.getData();
  }

  public String getNamespace() { return nameSpace; }

  public void close()
  {
    kubeClient.close();
  }
}
