package org.broadinstitute.tensorcaller.engine;

import htsjdk.samtools.SAMException;
import htsjdk.samtools.SAMSequenceRecord;
import htsjdk.samtools.reference.FastaSequenceIndex;
import htsjdk.samtools.reference.FastaSequenceIndexEntry;
import htsjdk.samtools.reference.ReferenceSequenceFile;
import htsjdk.samtools.reference.ReferenceSequenceFileFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.tensorcaller.exceptions.TensorCallerException;
import org.broadinstitute.tensorcaller.exceptions.UserException;
import org.broadinstitute.tensorcaller.utils.Utils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link ReferenceSource} over an indexed FASTA file. The {@code .fai} index next to the FASTA is required; it also
 * supplies the contig list for output headers.
 */
public final class FastaReferenceSource implements ReferenceSource {
    private static final Logger logger = LogManager.getLogger(FastaReferenceSource.class);

    private final Path fastaPath;
    private final ReferenceSequenceFile reference;
    private final List<SAMSequenceRecord> indexedContigs;

    public FastaReferenceSource(final Path fastaPath) {
        this.fastaPath = Utils.nonNull(fastaPath, "fastaPath");
        final Path indexPath = ReferenceSequenceFileFactory.getFastaIndexFileName(fastaPath);
        if (!Files.exists(indexPath)) {
            throw new UserException.CouldNotReadInputFile(fastaPath.toString(), "the FASTA index " + indexPath + " does not exist");
        }
        try {
            reference = ReferenceSequenceFileFactory.getReferenceSequenceFile(fastaPath);
            indexedContigs = readIndexedContigs(new FastaSequenceIndex(indexPath));
        } catch (final SAMException e) {
            throw new UserException.CouldNotReadInputFile(fastaPath, e);
        }
    }

    private static List<SAMSequenceRecord> readIndexedContigs(final FastaSequenceIndex index) {
        final List<SAMSequenceRecord> contigs = new ArrayList<>();
        for (final FastaSequenceIndexEntry entry : index) {
            final SAMSequenceRecord contig = new SAMSequenceRecord(entry.getContig(), (int) entry.getSize());
            contig.setSequenceIndex(contigs.size());
            contigs.add(contig);
        }
        return contigs;
    }

    /**
     * @return the contigs listed in the FASTA index, in index order
     */
    public List<SAMSequenceRecord> getIndexedContigs() {
        return indexedContigs;
    }

    @Override
    public String getBases(final String contig, final int start, final int end) {
        Utils.nonNull(contig, "contig");
        if (end <= start || start < 0) {
            return "";
        }
        try {
            return reference.getSubsequenceAt(contig, start + 1, end).getBaseString().toUpperCase();
        } catch (final SAMException | IllegalArgumentException e) {
            logger.debug(String.format("No reference bases for %s:%d-%d in %s: %s", contig, start + 1, end, fastaPath, e.getMessage()));
            return "";
        }
    }

    @Override
    public void close() {
        try {
            reference.close();
        } catch (final IOException e) {
            throw new TensorCallerException("Error closing reference file " + fastaPath, e);
        }
    }
}
