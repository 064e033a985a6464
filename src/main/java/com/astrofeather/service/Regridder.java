package com.astrofeather.service;

import com.astrofeather.exception.DimensionalityException;
import com.astrofeather.model.FitsImage;
import com.astrofeather.model.RegriddedImage;
import com.astrofeather.model.Wcs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Regridder {

    private static final Logger LOGGER = LoggerFactory.getLogger(Regridder.class);

    private final Reprojector reprojector;

    public Regridder() {
        this(new WcsReprojector());
    }

    public Regridder(Reprojector reprojector) {
        this.reprojector = reprojector;
    }

    public Reprojector reprojector() { return reprojector; }

    public RegriddedImage regrid(FitsImage reference, FitsImage source) {
        if (source.rank() != 2) throw new DimensionalityException("La imagen de baja resolución", source.rank(), 2);
        if (reference.rank() != 2) throw new DimensionalityException("La imagen de alta resolución", reference.rank(), 2);

        Wcs target = reference.wcs();
        double pixscale = target.pixelScale();
        LOGGER.debug("pixscale = {} deg, malla {}x{}", pixscale, target.rows(), target.cols());

        double[][] resampled = reprojector.reproject(source.matrix(), source.wcs(), target);
        return new RegriddedImage(resampled, target, source.unit(), pixscale);
    }
}
