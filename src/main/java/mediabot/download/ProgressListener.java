package mediabot.download;

@FunctionalInterface
public interface ProgressListener {

    /** percent в диапазоне 0..100 */
    void onProgress(double percent);
}
