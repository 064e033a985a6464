package com.astrofeather.service;

import com.astrofeather.model.FitsImage;

import java.io.File;
import java.io.IOException;

/**
 * Entrada de una combinación: una imagen ya cargada ({@link Handle}) o un
 * fichero FITS ({@link FilePath}). Se resuelve una única vez en la entrada.
 */
public interface ImageSource {

    /** Forma del array sin cargar los píxeles cuando es posible. */
    int[] shape() throws IOException;

    FitsImage resolve() throws IOException;

    String describe();

    static ImageSource of(FitsImage image) {
        return new Handle(image);
    }

    static ImageSource of(File file) {
        return new FilePath(file, 0);
    }

    static ImageSource of(File file, int extension) {
        return new FilePath(file, extension);
    }

    final class Handle implements ImageSource {
        private final FitsImage image;

        public Handle(FitsImage image) { this.image = image; }

        @Override public int[] shape() { return image.shape(); }
        @Override public FitsImage resolve() { return image; }
        @Override public String describe() { return "imagen en memoria " + image.wcs(); }
    }

    final class FilePath implements ImageSource {
        private final File file;
        private final int extension;
        private final FitsIoService io = new FitsIoService();

        public FilePath(File file, int extension) {
            this.file = file;
            this.extension = extension;
        }

        public File file() { return file; }

        @Override public int[] shape() throws IOException { return io.readShape(file, extension); }
        @Override public FitsImage resolve() throws IOException { return io.read(file, extension); }
        @Override public String describe() { return file.getName() + "[" + extension + "]"; }
    }
}
