// File: src/main/java/org/lokray/scope/util/ScopeReportConverter.java
package org.lokray.scope.util;

import org.lokray.scope.ast.Node;
import org.lokray.scope.ast.NodeKind;
import org.lokray.scope.ast.NodeTraverser;
import org.lokray.scope.dto.IdentifierDTO;
import org.lokray.scope.dto.ScopeDTO;
import org.lokray.scope.dto.ScopeReportDTO;
import org.lokray.scope.dto.VariableDTO;
import org.lokray.scope.semantic.Definition;
import org.lokray.scope.semantic.Reference;
import org.lokray.scope.semantic.Scope;
import org.lokray.scope.semantic.ScopeAnalysisResult;
import org.lokray.scope.semantic.ScopeGraph;
import org.lokray.scope.semantic.Variable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public class ScopeReportConverter
{
	public static ScopeReportDTO toReport(String source, ScopeAnalysisResult result)
	{
		ScopeGraph graph = result.graph();
		ScopeReportDTO report = new ScopeReportDTO();
		report.source = source;
		report.grammarMode = graph.getGrammarMode().name().toLowerCase(Locale.ROOT);
		report.hostedModule = graph.getOptions().treatAsHostedModule();
		report.ecmaVersion = graph.getOptions().ecmaVersion();

		report.scopes = new ArrayList<>();
		for (Scope scope : graph.getScopes())
		{
			report.scopes.add(scopeToDTO(scope));
		}

		report.implicitGlobals = new ArrayList<>();
		graph.getGlobalScope().getImplicitVariables().forEach(v -> report.implicitGlobals.add(v.getName()));

		report.identifiers = identifiersToDTO(result);
		return report;
	}

	private static ScopeDTO scopeToDTO(Scope scope)
	{
		ScopeDTO dto = new ScopeDTO();
		dto.id = scope.getId();
		dto.type = scope.getType().getLabel();
		dto.node = scope.getBlock().getKind().name();
		dto.line = scope.getBlock().getLine();
		dto.upper = scope.getUpper() != null ? scope.getUpper().getId() : null;
		dto.strict = scope.isStrict();
		dto.dynamic = scope.isDynamic();
		dto.references = scope.getReferences().size();

		dto.variables = new ArrayList<>();
		for (Variable variable : scope.getVariables())
		{
			VariableDTO vd = new VariableDTO();
			vd.name = variable.getName();
			vd.definitions = new ArrayList<>();
			for (Definition definition : variable.getDefinitions())
			{
				vd.definitions.add(definition.type().name().toLowerCase(Locale.ROOT));
			}
			vd.declaredAt = new ArrayList<>();
			variable.getIdentifiers().forEach(identifier -> vd.declaredAt.add(identifier.getLine()));
			vd.references = variable.getReferences().size();
			vd.captured = variable.isCaptured();
			dto.variables.add(vd);
		}

		// Distinct names, in order of first appearance
		dto.through = scope.getThrough().stream()
				.map(Reference::getName)
				.distinct()
				.toList();
		return dto;
	}

	private static List<IdentifierDTO> identifiersToDTO(ScopeAnalysisResult result)
	{
		Set<Node> declarations = Collections.newSetFromMap(new IdentityHashMap<>());
		Set<Node> references = Collections.newSetFromMap(new IdentityHashMap<>());
		for (Scope scope : result.graph().getScopes())
		{
			scope.getVariables().forEach(variable -> declarations.addAll(variable.getIdentifiers()));
			scope.getReferences().forEach(reference -> references.add(reference.getIdentifier()));
		}

		List<IdentifierDTO> out = new ArrayList<>();
		NodeTraverser.traverse(result.root(), (node, parentNode) ->
		{
			if (!node.is(NodeKind.IDENTIFIER))
			{
				return;
			}
			result.attachments().scopeOf(node).ifPresent(scope ->
			{
				IdentifierDTO dto = new IdentifierDTO();
				dto.name = node.getName();
				dto.line = node.getLine();
				dto.column = node.getColumn() + 1;
				dto.scope = scope.getId();
				if (declarations.contains(node))
				{
					dto.role = "declaration";
				}
				else if (references.contains(node))
				{
					dto.role = "reference";
				}
				else
				{
					dto.role = "other";
				}
				out.add(dto);
			});
		});
		return out;
	}
}
