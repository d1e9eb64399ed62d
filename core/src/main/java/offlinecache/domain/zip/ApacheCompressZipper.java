package offlinecache.domain.zip;

import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import offlinecache.domain.exceptions.DeserializationFailed;
import offlinecache.domain.exceptions.SerializationFailed;
import offlinecache.domain.timing.TimedOperation;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipParameters;
import org.apache.commons.io.IOUtils;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.util.zip.Deflater;

/**
 * A Zipper implementation that uses Apache Commons Compress to perform GZIP compression and decompression.
 */
@ApplicationScoped
public class ApacheCompressZipper implements Zipper {

    @Override
    public byte[] compress(final byte[] data) {
        final GzipParameters parameters = new GzipParameters();
        parameters.setCompressionLevel(Deflater.BEST_COMPRESSION);

        return Try.withResources(ByteArrayOutputStream::new)
                .of(bos -> Try.withResources(() -> new GzipCompressorOutputStream(bos, parameters))
                        .of(gcos -> writeStream(gcos, bos, data))
                        .get())
                .map(ByteArrayOutputStream::toByteArray)
                .getOrElseThrow(ex -> new SerializationFailed("Failed to compress " + data.length + " bytes", ex));
    }

    @Override
    public byte[] decompress(final byte[] compressedData) {
        return Try.withResources(() -> new TimedOperation("payload decompression"))
                .of(t -> decompressTimed(compressedData))
                .getOrElseThrow(ex -> new DeserializationFailed("Failed to decompress " + compressedData.length + " bytes", ex));
    }

    private byte[] decompressTimed(final byte[] compressedData) {
        return Try.withResources(() -> new GzipCompressorInputStream(new ByteArrayInputStream(compressedData)))
                .of(IOUtils::toByteArray)
                .get();
    }

    private ByteArrayOutputStream writeStream(final GzipCompressorOutputStream gcos, final ByteArrayOutputStream bos, final byte[] data) throws Exception {
        gcos.write(data);
        return bos;
    }
}
