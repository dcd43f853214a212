// File: src/main/java/org/lokray/scope/semantic/ScopeAnalysisResult.java
package org.lokray.scope.semantic;

import org.lokray.scope.ast.Node;

/**
 * What one scope analysis pass produced for a program.
 */
public record ScopeAnalysisResult(Node root, ScopeGraph graph, ScopeAttachments attachments)
{
}
