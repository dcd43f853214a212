// File: src/main/java/org/lokray/scope/semantic/ScopeAnalysisPass.java
package org.lokray.scope.semantic;

import org.lokray.scope.ast.Node;
import org.lokray.scope.ast.NodeTraverser;
import org.lokray.scope.ast.NodeVisitor;
import org.lokray.scope.util.Debug;

/**
 * Attaches a scope to every identifier of a program. The scope graph is built when the traversal
 * enters the program node and serves the rest of that traversal.
 */
public class ScopeAnalysisPass implements NodeVisitor
{
	private final GrammarModeProber prober;
	private final TargetEnvironment target;
	private ScopeGraph activeGraph;
	private ScopeAttachments attachments = new ScopeAttachments();

	public ScopeAnalysisPass(GrammarModeProber prober, TargetEnvironment target)
	{
		this.prober = prober;
		this.target = target;
	}

	public ScopeAnalysisPass(TargetEnvironment target)
	{
		this(new GrammarModeProber(new ScopeGraphAnalyzer()), target);
	}

	/**
	 * Runs the pass over {@code root}.
	 *
	 * @throws GraphConstructionException   if no grammar mode accepts the program
	 * @throws InvariantViolationException if the tree has a detached non-root node
	 */
	public ScopeAnalysisResult run(Node root)
	{
		activeGraph = null;
		attachments = new ScopeAttachments();
		NodeTraverser.traverse(root, this);
		Debug.logDebug("Attached scopes to " + attachments.size() + " identifiers.");
		return new ScopeAnalysisResult(root, activeGraph, attachments);
	}

	@Override
	public void enter(Node node, Node parentNode)
	{
		switch (node.getKind())
		{
			case PROGRAM ->
			{
				if (activeGraph == null)
				{
					activeGraph = prober.build(node, target.isHostedModule());
				}
			}
			case IDENTIFIER ->
			{
				if (activeGraph != null)
				{
					attachments.attach(node, ScopeResolver.resolve(activeGraph, node));
				}
			}
			default ->
			{
			}
		}
	}

	public ScopeGraph getActiveGraph()
	{
		return activeGraph;
	}

	public ScopeAttachments getAttachments()
	{
		return attachments;
	}
}
