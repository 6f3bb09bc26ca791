package org.broadinstitute.tensorcaller.engine;

import htsjdk.samtools.util.Locatable;
import org.broadinstitute.tensorcaller.exceptions.UserException;
import org.broadinstitute.tensorcaller.utils.Utils;

/**
 * One candidate position: its locus, the reference bases of the window centered on it, and the evidence tensor
 * summarizing the reads over that window. Immutable.
 *
 * Positions are stored 0-based. The textual descriptor {@code contig:position:referenceWindow} used by upstream
 * tensor generators carries the 1-based position of the window center.
 */
public final class Site implements Locatable {

    private final String contig;
    private final int position;
    private final String referenceWindow;
    private final EvidenceTensor tensor;

    public Site(final String contig, final int position, final String referenceWindow, final EvidenceTensor tensor) {
        this.contig = Utils.nonEmpty(contig, "contig");
        Utils.validateArg(position >= 0, () -> "position must be non-negative but was " + position);
        this.position = position;
        this.referenceWindow = Utils.nonEmpty(referenceWindow, "referenceWindow").toUpperCase();
        this.tensor = Utils.nonNull(tensor, "tensor");
        Utils.validateArg(referenceWindow.length() % 2 == 1, () -> "reference window must have odd width: " + referenceWindow);
        Utils.validateArg(referenceWindow.length() == tensor.getNumberOfPositions(),
                () -> String.format("reference window width %d does not match tensor width %d",
                        referenceWindow.length(), tensor.getNumberOfPositions()));
    }

    /**
     * Builds a site from its {@code contig:position:referenceWindow} descriptor. The contig may itself contain colons.
     */
    public static Site fromDescriptor(final String descriptor, final EvidenceTensor tensor) {
        Utils.nonNull(descriptor, "descriptor");
        final int windowSeparator = descriptor.lastIndexOf(':');
        final int positionSeparator = windowSeparator > 0 ? descriptor.lastIndexOf(':', windowSeparator - 1) : -1;
        if (positionSeparator <= 0) {
            throw new UserException.BadInput("site descriptor is not of the form contig:position:window: " + descriptor);
        }
        final int oneBasedPosition;
        try {
            oneBasedPosition = Integer.parseInt(descriptor.substring(positionSeparator + 1, windowSeparator));
        } catch (final NumberFormatException e) {
            throw new UserException.BadInput("site descriptor has a non-integer position: " + descriptor, e);
        }
        if (oneBasedPosition < 1) {
            throw new UserException.BadInput("site descriptor position must be at least 1: " + descriptor);
        }
        return new Site(descriptor.substring(0, positionSeparator), oneBasedPosition - 1,
                descriptor.substring(windowSeparator + 1), tensor);
    }

    /**
     * @return the {@code contig:position:referenceWindow} descriptor, 1-based
     */
    public String getDescriptor() {
        return contig + ":" + (position + 1) + ":" + referenceWindow;
    }

    @Override
    public String getContig() {
        return contig;
    }

    /**
     * @return 0-based position of the window center
     */
    public int getPosition() {
        return position;
    }

    @Override
    public int getStart() {
        return position + 1;
    }

    @Override
    public int getEnd() {
        return position + 1;
    }

    public String getReferenceWindow() {
        return referenceWindow;
    }

    public EvidenceTensor getTensor() {
        return tensor;
    }

    /**
     * @return index of the candidate position within the window (the number of flanking bases on each side)
     */
    public int getCenterIndex() {
        return referenceWindow.length() / 2;
    }

    public char getReferenceBase() {
        return referenceWindow.charAt(getCenterIndex());
    }

    @Override
    public String toString() {
        return contig + ":" + (position + 1);
    }
}
