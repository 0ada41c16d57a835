package com.splittree.render;

import com.splittree.common.errorsor.ErrorsOr;
import com.splittree.tree.ReconstructionResult;

/** Read-only presentation of a reconstructed tree. Renderers never mutate the nodes. */
@FunctionalInterface
public interface TreeRenderer {
    ErrorsOr<String> render(ReconstructionResult result);
}
