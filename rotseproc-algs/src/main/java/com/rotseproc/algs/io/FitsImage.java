package com.rotseproc.algs.io;

import java.io.BufferedInputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read access to the primary HDU of a FITS file: the header, and the data array as physical
 * values ({@code BZERO + BSCALE * raw}). Extensions and tables are not read.
 */
public final class FitsImage {
    static final int BLOCK = 2880;
    static final int CARD = 80;

    private final Path path;
    private final FitsHeader header;
    private final long dataOffset;

    private FitsImage(Path path, FitsHeader header, long dataOffset) {
        this.path = path;
        this.header = header;
        this.dataOffset = dataOffset;
    }

    public static FitsImage open(Path path) throws IOException {
        Map<String, String> values = new LinkedHashMap<>();
        long offset = 0;
        byte[] block = new byte[BLOCK];
        try (InputStream in = new BufferedInputStream(Files.newInputStream(path))) {
            boolean more = true;
            while (more) {
                readBlock(in, block, path);
                offset += BLOCK;
                for (int i = 0; i < BLOCK && more; i += CARD) {
                    more = FitsHeader.parseCard(new String(block, i, CARD, StandardCharsets.US_ASCII), values);
                }
            }
        }
        if (!"T".equals(values.get("SIMPLE"))) throw new IOException("Not a FITS primary header: " + path);
        return new FitsImage(path, new FitsHeader(values), offset);
    }

    /** Header only; cheaper than reading pixels when a keyword such as {@code SATCNTS} is all that is needed. */
    public static FitsHeader readHeader(Path path) throws IOException {
        return open(path).header();
    }

    public Path path() {
        return path;
    }

    public FitsHeader header() {
        return header;
    }

    public int bitpix() throws IOException {
        return header.integer("BITPIX");
    }

    /** Number of pixels in the primary array; 0 when NAXIS is 0. */
    public long pixelCount() throws IOException {
        int naxis = header.integer("NAXIS");
        if (naxis == 0) return 0;
        long n = 1;
        for (int i = 1; i <= naxis; i++) n *= header.integer("NAXIS" + i);
        return n;
    }

    /** Mean physical pixel value; NaN pixels are skipped, and an empty array gives NaN. */
    public double meanPixel() throws IOException {
        int bitpix = bitpix();
        long count = pixelCount();
        double bzero = header.number("BZERO", 0.0);
        double bscale = header.number("BSCALE", 1.0);

        double sum = 0;
        long used = 0;
        try (DataInputStream in = new DataInputStream(new BufferedInputStream(Files.newInputStream(path), 1 << 16))) {
            in.skipNBytes(dataOffset);
            for (long i = 0; i < count; i++) {
                double raw = readPixel(in, bitpix);
                if (Double.isNaN(raw)) continue;
                sum += bzero + bscale * raw;
                used++;
            }
        } catch (EOFException e) {
            throw new IOException("Truncated FITS data in " + path, e);
        }
        return used == 0 ? Double.NaN : sum / used;
    }

    private static double readPixel(DataInputStream in, int bitpix) throws IOException {
        switch (bitpix) {
            case 8: return in.readUnsignedByte();
            case 16: return in.readShort();
            case 32: return in.readInt();
            case 64: return in.readLong();
            case -32: return in.readFloat();
            case -64: return in.readDouble();
            default: throw new IOException("Unsupported BITPIX " + bitpix);
        }
    }

    private static void readBlock(InputStream in, byte[] block, Path path) throws IOException {
        int off = 0;
        while (off < block.length) {
            int n = in.read(block, off, block.length - off);
            if (n < 0) throw new IOException("FITS header not terminated by END: " + path);
            off += n;
        }
    }
}
