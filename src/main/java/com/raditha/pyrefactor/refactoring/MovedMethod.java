package com.raditha.pyrefactor.refactoring;

import com.raditha.pyrefactor.model.MethodInfo;

/**
 * @param methodText       the method as inserted in the target class
 * @param callSitesUpdated number of {@code self.method(...)} calls rewritten in the source class
 * @param method           what the analysis found about the method
 * @param newContent       the file after the change
 */
public record MovedMethod(
        String methodText,
        int callSitesUpdated,
        MethodInfo method,
        String newContent) {
}
