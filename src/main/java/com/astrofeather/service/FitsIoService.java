package com.astrofeather.service;

import com.astrofeather.model.BrightnessUnit;
import com.astrofeather.model.FitsImage;
import com.astrofeather.model.Wcs;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

public class FitsIoService {

    private static final Logger LOGGER = LoggerFactory.getLogger(FitsIoService.class);

    public FitsImage read(File f) throws IOException {
        return read(f, 0);
    }

    public FitsImage read(File f, int extension) throws IOException {
        try (Fits fits = new Fits(f)) {
            BasicHDU<?> hdu = fits.getHDU(extension);
            if (hdu == null) throw new IOException("No existe la extensión " + extension + " en " + f.getName());
            Header header = hdu.getHeader();
            Geometry g = geometry(header);

            double[] data = new double[(int) g.size()];
            Scaling s = new Scaling(header);
            int filled = flatten(hdu.getKernel(), data, 0, s);
            if (filled != data.length) {
                throw new IOException(String.format("%s: %d muestras leídas, se esperaban %d", f.getName(), filled, data.length));
            }

            Wcs wcs = Wcs.fromHeader(header, g.shape, g.fitsAxes);
            BrightnessUnit unit = BrightnessUnit.fromFits(header.getStringValue("BUNIT"));
            LOGGER.debug("Leído {} [{}]: {} unidad={}", f.getName(), extension, wcs, unit);
            return new FitsImage(data, wcs, unit);
        } catch (FitsException e) {
            throw new IOException("Error FITS leyendo " + f.getName() + ": " + e.getMessage(), e);
        }
    }

    /** Forma (sin ejes degenerados por encima del espectral) leyendo sólo la cabecera. */
    public int[] readShape(File f, int extension) throws IOException {
        try (Fits fits = new Fits(f)) {
            BasicHDU<?> hdu = fits.getHDU(extension);
            if (hdu == null) throw new IOException("No existe la extensión " + extension + " en " + f.getName());
            return geometry(hdu.getHeader()).shape;
        } catch (FitsException e) {
            throw new IOException("Error FITS leyendo cabecera de " + f.getName() + ": " + e.getMessage(), e);
        }
    }

    /** Escribe la imagen (2-D o 3-D) con su WCS, unidad y haz en un HDU primario. */
    public void write(File out, FitsImage image) throws IOException {
        Object data = image.rank() == 2 ? image.matrix() : image.cube();
        try {
            BasicHDU<?> hdu = Fits.makeHDU(data);
            Header h = hdu.getHeader();
            image.wcs().writeTo(h);
            if (image.unit().isBrightness()) h.addValue("BUNIT", image.unit().fitsName(), "");
            h.addValue("ORIGIN", "FeatherSuite", "");

            Files.deleteIfExists(out.toPath());
            try (Fits fits = new Fits()) {
                fits.addHDU(hdu);
                fits.write(out);
            }
            LOGGER.info("Escrito {} ({} muestras)", out.getName(), image.size());
        } catch (FitsException e) {
            throw new IOException("Error FITS escribiendo " + out.getName() + ": " + e.getMessage(), e);
        }
    }

    // --- AUXILIARES ---

    private static final class Geometry {
        final int[] shape;
        final int[] fitsAxes;
        Geometry(int[] shape, int[] fitsAxes) { this.shape = shape; this.fitsAxes = fitsAxes; }
        long size() {
            long n = 1;
            for (int s : shape) n *= s;
            return n;
        }
    }

    // Orden C (NAXISn ... NAXIS1). Los ejes celestes se conservan siempre; de los
    // demás sólo los de longitud > 1, y si no queda ninguno se conserva NAXIS3
    // para que un cubo de un canal siga siendo un cubo.
    private static Geometry geometry(Header h) throws IOException {
        int naxis = h.getIntValue("NAXIS", 0);
        if (naxis < 1) throw new IOException("HDU sin datos (NAXIS=0)");
        List<Integer> dims = new ArrayList<>();
        List<Integer> axes = new ArrayList<>();
        for (int n = naxis; n >= 3; n--) {
            int len = h.getIntValue("NAXIS" + n, 1);
            if (len > 1) {
                dims.add(len);
                axes.add(n);
            }
        }
        if (naxis >= 3 && dims.isEmpty()) {
            dims.add(h.getIntValue("NAXIS3", 1));
            axes.add(3);
        }
        for (int n = Math.min(naxis, 2); n >= 1; n--) {
            dims.add(h.getIntValue("NAXIS" + n, 1));
            axes.add(n);
        }
        return new Geometry(dims.stream().mapToInt(Integer::intValue).toArray(),
                axes.stream().mapToInt(Integer::intValue).toArray());
    }

    private static final class Scaling {
        final double bscale, bzero;
        final boolean hasBlank;
        final long blank;

        Scaling(Header h) {
            bscale = h.getDoubleValue("BSCALE", 1.0);
            bzero = h.getDoubleValue("BZERO", 0.0);
            hasBlank = h.containsKey("BLANK");
            blank = h.getLongValue("BLANK", 0L);
        }

        double integer(long raw) {
            if (hasBlank && raw == blank) return Double.NaN;
            return bzero + bscale * raw;
        }
    }

    private static int flatten(Object k, double[] out, int pos, Scaling s) {
        if (k instanceof Object[]) {
            for (Object sub : (Object[]) k) pos = flatten(sub, out, pos, s);
            return pos;
        }
        if (k instanceof float[]) { for (float v : (float[]) k) out[pos++] = v; return pos; }
        if (k instanceof double[]) { for (double v : (double[]) k) out[pos++] = v; return pos; }
        if (k instanceof short[]) { for (short v : (short[]) k) out[pos++] = s.integer(v); return pos; }
        if (k instanceof int[]) { for (int v : (int[]) k) out[pos++] = s.integer(v); return pos; }
        if (k instanceof long[]) { for (long v : (long[]) k) out[pos++] = s.integer(v); return pos; }
        // BITPIX 8 es sin signo
        if (k instanceof byte[]) { for (byte v : (byte[]) k) out[pos++] = s.integer(v & 0xFF); return pos; }
        throw new IllegalArgumentException("Tipo de datos FITS no soportado: " + (k == null ? "null" : k.getClass()));
    }
}
