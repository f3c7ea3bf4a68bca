package de.bsommerfeld.marketscope.core.domain;

/**
 * An externally stored chunk of a document and the pages it covers,
 * both bounds inclusive and 1-based.
 *
 * @param handle opaque identifier issued by the upload pipeline
 */
public record ChunkRange(String handle, int startPage, int endPage) {

    public int pageCount() {
        return endPage - startPage + 1;
    }
}
