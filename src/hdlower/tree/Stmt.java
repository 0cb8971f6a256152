package hdlower.tree;

/** Statement nodes of an entity body. */
public interface Stmt extends Tree {}
