/**
 * This package contains the expression tree: the node classes, the
 * declarations they refer to, and the context that allocates and owns
 * every node of a compilation unit.
 */
package exm.sema.ast;
