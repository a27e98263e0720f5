/// Normalization of C# syntax trees into canonical semantic trees.
///
/// [Normalizer] is the entry point. The structural operators [MoveTrivia], [MergeGroups],
/// [KeywordFlag], [ArrayToChain] and [DropNils] do the work that plain pattern rules cannot:
/// moving comments out of nodes, merging wrapper nodes, and reshaping modifier lists.
/// [NormalizerConfig] holds the lookup tables they use.
package uast.normalizer;
