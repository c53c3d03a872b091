package shamir;

public class Constants {
    public final static String TAG_INTERPOLATION = "reconstruction.interpolation";
    public final static String TAG_VOTING_THREADS = "reconstruction.voting_threads";
    public final static String TAG_VOTING_BATCH_SIZE = "reconstruction.voting_batch_size";

    public final static String VALUE_LAGRANGE = "lagrange";
    public final static String VALUE_GAUSSIAN = "gaussian";

    public final static int DEFAULT_VOTING_THREADS = 1;
    public final static int DEFAULT_VOTING_BATCH_SIZE = 256;
}
