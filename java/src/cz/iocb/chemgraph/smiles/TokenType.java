package cz.iocb.chemgraph.smiles;



enum TokenType
{
    ATOM, BRACKET_ATOM, BOND, BRANCH_OPEN, BRANCH_CLOSE, RING_CLOSURE
}
