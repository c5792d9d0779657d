/**
 * The frontend package contains the classes that work over expression
 * trees during semantic analysis: walking and rewriting them, dumping
 * them, and (in typecheck) ranking implicit conversions.
 */
package exm.sema.frontend;
