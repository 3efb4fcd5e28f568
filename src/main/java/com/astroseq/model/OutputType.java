package com.astroseq.model;

public enum OutputType {
    /** Single FITS file holding every frame; sizes may differ when the preference allows it. */
    FITSEQ,
    /** SER video container; one geometry per file. */
    SER,
    /** One FITS file per frame. */
    FITS_FILES;

    public boolean requiresFixedGeometry(boolean heterogeneousFitseqAllowed) {
        switch (this) {
            case SER: return true;
            case FITSEQ: return !heterogeneousFitseqAllowed;
            default: return false;
        }
    }
}
