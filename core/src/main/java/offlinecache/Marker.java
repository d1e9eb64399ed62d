package offlinecache;

/**
 * A marker class used to identify the root package when scanning for beans.
 */
public class Marker {
}
