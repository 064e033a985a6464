package com.astrofeather.service;

import com.astrofeather.exception.DimensionalityException;
import com.astrofeather.exception.FeatherException;
import com.astrofeather.exception.PreconditionException;
import com.astrofeather.model.Angle;
import com.astrofeather.model.CubeFeatherResult;
import com.astrofeather.model.FeatherOptions;
import com.astrofeather.model.FitsImage;
import com.astrofeather.model.KernelPair;
import com.astrofeather.model.MergeOptions;
import com.astrofeather.model.Wcs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Combinación de cubos espectrales plano a plano. Un único par de kernels
 * para todo el cubo; cada plano se combina de forma independiente en un pool
 * de hilos y escribe sólo su propia posición de salida.
 */
public class CubeFeatherService {

    private static final Logger LOGGER = LoggerFactory.getLogger(CubeFeatherService.class);

    /** Límite duro de elementos del cubo de alta resolución (todo en memoria). */
    public static final long MAX_CUBE_ELEMENTS = 100_000_000L;

    /** Avance por planos; se invoca desde los hilos de trabajo. */
    public interface ProgressListener {
        void onPlaneDone(int done, int total);
    }

    private final Reprojector reprojector;
    private final FeatherKernelBuilder kernelBuilder;
    private final FourierMerger merger;

    public CubeFeatherService() {
        this(new WcsReprojector(), new FeatherKernelBuilder(), new FourierMerger());
    }

    public CubeFeatherService(Reprojector reprojector, FeatherKernelBuilder kernelBuilder, FourierMerger merger) {
        this.reprojector = reprojector;
        this.kernelBuilder = kernelBuilder;
        this.merger = merger;
    }

    public CubeFeatherResult feather(ImageSource highRes, ImageSource lowRes, FeatherOptions options)
            throws IOException, InterruptedException {
        return feather(highRes, lowRes, options, null);
    }

    public CubeFeatherResult feather(ImageSource highRes, ImageSource lowRes, FeatherOptions options,
                                     ProgressListener listener) throws IOException, InterruptedException {
        // Se comprueba antes de cargar nada
        long elements = 1;
        for (int s : highRes.shape()) elements *= s;
        if (elements > MAX_CUBE_ELEMENTS) {
            throw new PreconditionException(String.format(
                    "el cubo tiene %d elementos (> %d), demasiado grande para combinar en memoria", elements, MAX_CUBE_ELEMENTS));
        }

        FitsImage hi = highRes.resolve();
        FitsImage lo = lowRes.resolve();
        if (hi.rank() != 3) throw new DimensionalityException("El cubo de alta resolución", hi.rank(), 3);
        if (lo.rank() != 3) throw new DimensionalityException("El cubo de baja resolución", lo.rank(), 3);

        if (!hi.unit().isBrightness()) {
            throw new PreconditionException("los cubos deben tener unidades de brillo (Jy/beam o K), no '" + hi.unit().fitsName() + "'");
        }
        double unitFactor = lo.unit().conversionTo(hi.unit());

        if (hi.planes() != lo.planes()) {
            throw new PreconditionException(String.format(
                    "número de canales distinto (%d vs %d); regridear espectralmente antes", hi.planes(), lo.planes()));
        }

        Wcs hiWcs = hi.wcs();
        double pixscale = hiWcs.pixelScale();
        Angle fwhm = PlaneFeatherService.resolveFwhm(options.lowResFwhm(), lo);

        LOGGER.info("Regrideando cubo (puede tardar)");
        double[][][] loRegridded = reprojector.reprojectCube(lo.cube(), lo.wcs(), hiWcs);

        KernelPair kernels = kernelBuilder.build(hiWcs.rows(), hiWcs.cols(), fwhm, pixscale);

        int total = hi.planes();
        double[][][] out = new double[total][][];
        double hiScale = options.highResScale();
        double loScale = options.lowResScale() * unitFactor;
        MergeOptions mergeOptions = options.merge();

        LOGGER.info("Combinando en Fourier cada uno de los {} planos ({} hilos)", total, options.workerThreads());
        AtomicInteger done = new AtomicInteger(0);
        ExecutorService exec = Executors.newFixedThreadPool(Math.min(options.workerThreads(), total));
        try {
            List<Future<?>> futures = new ArrayList<>(total);
            for (int i = 0; i < total; i++) {
                final int plane = i;
                futures.add(exec.submit(() -> {
                    double[][] h = PlaneFeatherService.scale(hi.plane(plane), hiScale);
                    double[][] l = PlaneFeatherService.scale(loRegridded[plane], loScale);
                    out[plane] = merger.merge(kernels, h, l, mergeOptions).combined.realPart();
                    int n = done.incrementAndGet();
                    if (listener != null) listener.onPlaneDone(n, total);
                }));
            }
            for (Future<?> f : futures) {
                try {
                    f.get();
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof RuntimeException) throw (RuntimeException) cause;
                    if (cause instanceof Error) throw (Error) cause;
                    throw new FeatherException("Fallo combinando un plano", cause);
                }
            }
        } catch (InterruptedException e) {
            LOGGER.warn("Combinación del cubo interrumpida tras {} de {} planos", done.get(), total);
            throw e;
        } finally {
            exec.shutdownNow();
        }

        FitsImage regridded = options.keepRegridded()
                ? FitsImage.ofCube(loRegridded, hiWcs, lo.unit())
                : null;
        return new CubeFeatherResult(out, hiWcs, hi.unit(), regridded);
    }
}
