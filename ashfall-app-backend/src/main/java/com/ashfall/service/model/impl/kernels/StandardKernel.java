package com.ashfall.service.model.impl.kernels;

import com.ashfall.service.model.RadialBasisFunction;

import java.util.Locale;

/**
 * The usual radial basis kernels. Only the multiquadric family and the
 * gaussian use the shape parameter.
 */
public enum StandardKernel implements RadialBasisFunction {

    MULTIQUADRIC {
        @Override
        public double evaluate(double r, double epsilon) {
            double s = r / epsilon;
            return Math.sqrt(s * s + 1.0);
        }
    },
    INVERSE_MULTIQUADRIC {
        @Override
        public double evaluate(double r, double epsilon) {
            double s = r / epsilon;
            return 1.0 / Math.sqrt(s * s + 1.0);
        }
    },
    GAUSSIAN {
        @Override
        public double evaluate(double r, double epsilon) {
            double s = r / epsilon;
            return Math.exp(-s * s);
        }
    },
    LINEAR {
        @Override
        public double evaluate(double r, double epsilon) {
            return r;
        }
    },
    CUBIC {
        @Override
        public double evaluate(double r, double epsilon) {
            return r * r * r;
        }
    },
    QUINTIC {
        @Override
        public double evaluate(double r, double epsilon) {
            double r2 = r * r;
            return r2 * r2 * r;
        }
    },
    THIN_PLATE {
        @Override
        public double evaluate(double r, double epsilon) {
            // r^2 log r tends to 0 at the origin
            return r == 0.0 ? 0.0 : r * r * Math.log(r);
        }
    };

    /**
     * Resolves a kernel by name, case-insensitive; dashes are accepted for underscores.
     */
    public static StandardKernel fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Kernel name is required");
        }
        String key = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return valueOf(key);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported RBF kernel: " + name, e);
        }
    }
}
